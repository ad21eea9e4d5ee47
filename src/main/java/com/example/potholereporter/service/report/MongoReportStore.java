package com.example.potholereporter.service.report;

import com.example.potholereporter.model.report.Report;
import com.example.potholereporter.service.lifecycle.Transition;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.util.List;
import java.util.Optional;

public class MongoReportStore implements ReportStore {

    private final MongoTemplate mongoTemplate;

    public MongoReportStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public Report insert(Report report) {
        return mongoTemplate.insert(report);
    }

    @Override
    public Optional<Report> findById(String id) {
        return Optional.ofNullable(mongoTemplate.findById(id, Report.class));
    }

    @Override
    public List<Report> find(ReportFilter filter, int limit) {
        Query query = new Query();
        if (filter.status() != null) {
            query.addCriteria(Criteria.where(Report.FIELD_STATUS).is(filter.status()));
        }
        if (filter.severity() != null) {
            query.addCriteria(Criteria.where(Report.FIELD_SEVERITY).is(filter.severity()));
        }
        if (filter.ownerId() != null) {
            query.addCriteria(Criteria.where(Report.FIELD_OWNER).is(filter.ownerId()));
        }
        query.with(Sort.by(Sort.Direction.DESC, Report.FIELD_CREATED_AT)).limit(limit);
        return mongoTemplate.find(query, Report.class);
    }

    @Override
    public Optional<Report> applyTransition(String id, Transition transition) {
        Query query = Query.query(Criteria.where(Report.FIELD_ID).is(id));
        Update update = new Update()
                .push(Report.FIELD_AUDIT, transition.entry())
                .set(Report.FIELD_UPDATED_AT, transition.entry().timestamp());
        if (transition.targetStatus() != null) {
            update.set(Report.FIELD_STATUS, transition.targetStatus());
        }
        if (transition.targetDroneStatus() != null) {
            update.set(Report.FIELD_DRONE_STATUS, transition.targetDroneStatus());
        }
        Report updated = mongoTemplate.findAndModify(query, update,
                FindAndModifyOptions.options().returnNew(true), Report.class);
        return Optional.ofNullable(updated);
    }
}
