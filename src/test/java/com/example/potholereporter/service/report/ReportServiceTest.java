package com.example.potholereporter.service.report;

import com.example.potholereporter.model.BoundingBox;
import com.example.potholereporter.model.Detection;
import com.example.potholereporter.model.Severity;
import com.example.potholereporter.model.api.ActionResponse;
import com.example.potholereporter.model.api.NotifyResponse;
import com.example.potholereporter.model.api.ReportSubmissionResponse;
import com.example.potholereporter.model.notification.DeliveryStatus;
import com.example.potholereporter.model.notification.Notification;
import com.example.potholereporter.model.report.AuditEntry;
import com.example.potholereporter.model.report.DroneStatus;
import com.example.potholereporter.model.report.Report;
import com.example.potholereporter.model.report.ReportStatus;
import com.example.potholereporter.model.user.Role;
import com.example.potholereporter.service.detection.DetectionGatewayException;
import com.example.potholereporter.service.detection.PotholeDetector;
import com.example.potholereporter.service.detection.UploadedImage;
import com.example.potholereporter.service.estimation.GeometricEstimator;
import com.example.potholereporter.service.estimation.LaneWidthScaleModel;
import com.example.potholereporter.service.lifecycle.Actor;
import com.example.potholereporter.service.lifecycle.ReportLifecycle;
import com.example.potholereporter.service.notification.NotificationService;
import com.example.potholereporter.service.storage.ImageStorage;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReportServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T09:30:00Z");
    private static final String AUTHORITY_PHONE = "+910000000001";

    @Mock
    private PotholeDetector detector;

    @Mock
    private ImageStorage imageStorage;

    @Mock
    private NotificationService notificationService;

    private InMemoryReportStore reportStore;
    private ReportService service;

    @BeforeEach
    void setUp() {
        reportStore = new InMemoryReportStore();
        service = new ReportService(detector,
                new GeometricEstimator(new LaneWidthScaleModel(3.5)),
                imageStorage,
                reportStore,
                notificationService,
                new ReportLifecycle(Clock.fixed(NOW, ZoneOffset.UTC)),
                new ObjectMapper(),
                AUTHORITY_PHONE);
    }

    @Test
    void submitStoresPendingReportWithEstimate() throws IOException {
        when(detector.detect(any(UploadedImage.class)))
                .thenReturn(List.of(new Detection(new BoundingBox(10, 10, 100, 50), 0.9)));
        when(imageStorage.store(any(byte[].class), anyString(), eq("image/png")))
                .thenAnswer(invocation -> "/uploads/" + invocation.getArgument(1));

        ReportSubmissionResponse response = service.submit(
                submission(1000, "{\"lat\": 18.52, \"lng\": 73.85}", null), new Actor("user-1", Role.CITIZEN));

        Report report = response.report();
        assertThat(report.status()).isEqualTo(ReportStatus.PENDING);
        assertThat(report.droneStatus()).isEqualTo(DroneStatus.UNASSIGNED);
        assertThat(report.ownerId()).isEqualTo("user-1");
        assertThat(report.detectionCount()).isEqualTo(1);
        assertThat(report.totalAreaSquareMeters()).isCloseTo(0.06125, within(1e-9));
        assertThat(report.severity()).isEqualTo(Severity.MINOR);
        assertThat(report.bagsRequired()).isEqualTo(1);
        assertThat(report.estimatedCost()).isEqualTo(350L);
        assertThat(report.coordinates().latitude()).isEqualTo(18.52);
        assertThat(report.imageUrl()).startsWith("/uploads/").endsWith(".png");
        assertThat(report.annotatedImageUrl()).startsWith("/uploads/processed_");
        assertThat(report.audit()).singleElement().satisfies(entry -> {
            assertThat(entry.action()).isEqualTo("upload");
            assertThat(entry.actorId()).isEqualTo("user-1");
            assertThat(entry.timestamp()).isEqualTo(NOW);
        });
        assertThat(report.createdAt()).isEqualTo(NOW);
        assertThat(response.detections()).hasSize(1);
        assertThat(reportStore.findById(report.id())).contains(report);
    }

    @Test
    void annotatedImageOfBitmapUploadIsStoredAsJpeg() throws IOException {
        when(detector.detect(any(UploadedImage.class)))
                .thenReturn(List.of(new Detection(new BoundingBox(10, 10, 100, 50), 0.9)));
        when(imageStorage.store(any(byte[].class), anyString(), anyString()))
                .thenAnswer(invocation -> "/uploads/" + invocation.getArgument(1));
        BufferedImage image = new BufferedImage(400, 300, BufferedImage.TYPE_3BYTE_BGR);
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        ImageIO.write(image, "bmp", output);
        ReportSubmission bitmap = new ReportSubmission("street.bmp", "image/bmp", output.toByteArray(),
                "MG Road", "{\"lat\": 18.52, \"lng\": 73.85}", null);

        Report report = service.submit(bitmap, null).report();

        assertThat(report.imageUrl()).endsWith(".bmp");
        assertThat(report.annotatedImageUrl()).startsWith("/uploads/processed_").endsWith(".jpg");
        ArgumentCaptor<byte[]> annotated = ArgumentCaptor.forClass(byte[].class);
        verify(imageStorage).store(annotated.capture(), startsWith("processed_"), eq("image/jpeg"));
        assertThat(annotated.getValue()).startsWith((byte) 0xFF, (byte) 0xD8);
    }

    @Test
    void zeroDetectionsStillCreatesMinorReportWithoutAnnotatedImage() throws IOException {
        when(detector.detect(any(UploadedImage.class))).thenReturn(List.of());
        when(imageStorage.store(any(byte[].class), anyString(), anyString())).thenReturn("/uploads/x.png");

        Report report = service.submit(submission(640, "{\"latitude\": 1, \"longitude\": 2}", 1.5), null).report();

        assertThat(report.detectionCount()).isZero();
        assertThat(report.totalAreaSquareMeters()).isZero();
        assertThat(report.confidence()).isZero();
        assertThat(report.severity()).isEqualTo(Severity.MINOR);
        assertThat(report.bagsRequired()).isEqualTo(1);
        assertThat(report.annotatedImageUrl()).isNull();
        assertThat(report.ownerId()).isNull();
        verify(imageStorage, never()).store(any(byte[].class), startsWith("processed_"), anyString());
    }

    @Test
    void malformedCoordinatesAreRejectedBeforeAnyGatewayCall() {
        assertThatThrownBy(() -> service.submit(submission(100, "not json", null), null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.submit(submission(100, "{\"lat\": 95, \"lng\": 0}", null), null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.submit(submission(100, "{\"lat\": \"x\"}", null), null))
                .isInstanceOf(IllegalArgumentException.class);

        verifyNoInteractions(detector, imageStorage);
    }

    @Test
    void nonPositiveDistanceFactorIsRejected() {
        assertThatThrownBy(() -> service.submit(submission(100, "{\"lat\": 1, \"lng\": 1}", 0d), null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Distance factor");
        verifyNoInteractions(detector);
    }

    @Test
    void undecodableImageIsRejected() {
        ReportSubmission garbage = new ReportSubmission("x.jpg", "image/jpeg", new byte[] {1, 2, 3},
                "Somewhere", "{\"lat\": 1, \"lng\": 1}", null);

        assertThatThrownBy(() -> service.submit(garbage, null)).isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(detector, imageStorage);
    }

    @Test
    void detectionFailureDoesNotPersistAnything() throws IOException {
        when(detector.detect(any(UploadedImage.class))).thenThrow(new DetectionGatewayException("down"));

        assertThatThrownBy(() -> service.submit(submission(100, "{\"lat\": 1, \"lng\": 1}", null), null))
                .isInstanceOf(DetectionGatewayException.class);
        assertThat(reportStore.find(ReportFilter.all(), 10)).isEmpty();
        verifyNoInteractions(imageStorage);
    }

    @Test
    void applyActionUpdatesStatusAndAppendsAudit() {
        reportStore.insert(ReportFixtures.report("r-1", "u-1", ReportStatus.PENDING, Severity.MINOR, NOW));
        Actor officer = new Actor("officer", Role.AUTHORITY);

        ActionResponse response = service.applyAction("r-1", "schedule_repair", "crew B", officer);

        assertThat(response.newStatus()).isEqualTo(ReportStatus.IN_PROGRESS);
        assertThat(response.report().audit()).hasSize(2);
        assertThat(response.report().audit().get(1).action()).isEqualTo("schedule-repair");
        assertThat(response.report().audit().get(1).notes()).isEqualTo("crew B");
    }

    @Test
    void unknownActionIsAuditedWithoutStatusChange() {
        reportStore.insert(ReportFixtures.report("r-1", "u-1", ReportStatus.PENDING, Severity.MINOR, NOW));

        ActionResponse response = service.applyAction("r-1", "photographed-site", null, Actor.anonymous());

        assertThat(response.newStatus()).isEqualTo(ReportStatus.PENDING);
        assertThat(response.report().audit()).extracting(AuditEntry::action)
                .containsExactly("upload", "photographed-site");
    }

    @Test
    void actionOnUnknownReportIsNotFound() {
        assertThatThrownBy(() -> service.applyAction("missing", "repair-done", null, Actor.anonymous()))
                .isInstanceOf(ReportNotFoundException.class);
    }

    @Test
    void notifyAuthoritySendsSmsAndMarksReported() {
        reportStore.insert(ReportFixtures.report("r-1", "u-1", ReportStatus.PENDING, Severity.MINOR, NOW));
        when(notificationService.send(eq(AUTHORITY_PHONE), anyString(), eq("r-1")))
                .thenReturn(new Notification("n-1", AUTHORITY_PHONE, "msg", DeliveryStatus.MOCKED, null, null, "r-1", NOW));

        NotifyResponse response = service.notifyAuthority("r-1", null, new Actor("officer", Role.AUTHORITY));

        assertThat(response.newStatus()).isEqualTo(ReportStatus.REPORTED);
        assertThat(response.deliveryStatus()).isEqualTo(DeliveryStatus.MOCKED);
        assertThat(response.notificationId()).isEqualTo("n-1");
        assertThat(service.get("r-1").audit()).last()
                .satisfies(entry -> assertThat(entry.action()).isEqualTo("notify-authority"));
    }

    @Test
    void failedSmsStillMarksReported() {
        reportStore.insert(ReportFixtures.report("r-1", "u-1", ReportStatus.PENDING, Severity.MINOR, NOW));
        when(notificationService.send(eq(AUTHORITY_PHONE), anyString(), eq("r-1")))
                .thenReturn(new Notification("n-2", AUTHORITY_PHONE, "msg", DeliveryStatus.FAILED, null, "boom", "r-1", NOW));

        ActionResponse response = service.applyAction("r-1", "notify-authority", null, Actor.anonymous());

        assertThat(response.newStatus()).isEqualTo(ReportStatus.REPORTED);
        assertThat(response.report().status()).isEqualTo(ReportStatus.REPORTED);
    }

    @Test
    void notifyOnUnknownReportSendsNothing() {
        assertThatThrownBy(() -> service.notifyAuthority("missing", null, Actor.anonymous()))
                .isInstanceOf(ReportNotFoundException.class);
        verifyNoInteractions(notificationService);
    }

    @Test
    void authorityMessageMentionsLocationSeverityAndCost() {
        Report report = ReportFixtures.report("r-9", null, ReportStatus.PENDING, Severity.MINOR, NOW);

        assertThat(ReportService.authorityMessage(report))
                .isEqualTo("New pothole reported at MG Road, Pune. Severity: Minor, Area: 0.18m², Cost: ₹700. ID: r-9");
    }

    private static ReportSubmission submission(int width, String coordinates, Double distanceFactor) throws IOException {
        BufferedImage image = new BufferedImage(width, Math.max(1, width / 2), BufferedImage.TYPE_3BYTE_BGR);
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        ImageIO.write(image, "png", output);
        return new ReportSubmission("street.png", "image/png", output.toByteArray(), "MG Road", coordinates, distanceFactor);
    }
}
