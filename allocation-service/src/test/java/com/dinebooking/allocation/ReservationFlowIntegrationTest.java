package com.dinebooking.allocation;

import com.dinebooking.allocation.api.dto.CreateBlackoutRequest;
import com.dinebooking.allocation.api.dto.CreateBlackoutResponse;
import com.dinebooking.allocation.api.dto.CreateReservationRequest;
import com.dinebooking.allocation.api.dto.ReservationResponse;
import com.dinebooking.allocation.domain.lock.InProcessLockCoordinator;
import com.dinebooking.allocation.domain.metrics.AllocationMetrics;
import com.dinebooking.allocation.domain.model.Blackout.BlackoutReason;
import com.dinebooking.allocation.domain.model.DiningTable;
import com.dinebooking.allocation.domain.model.Reservation;
import com.dinebooking.allocation.domain.model.Reservation.ReservationStatus;
import com.dinebooking.allocation.domain.model.Restaurant;
import com.dinebooking.allocation.domain.model.Sector;
import com.dinebooking.allocation.domain.model.ServiceWindow;
import com.dinebooking.allocation.domain.repository.BlackoutRepository;
import com.dinebooking.allocation.domain.repository.DiningTableRepository;
import com.dinebooking.allocation.domain.repository.ReservationRepository;
import com.dinebooking.allocation.domain.repository.RestaurantRepository;
import com.dinebooking.allocation.domain.repository.SectorRepository;
import com.dinebooking.allocation.domain.repository.ServiceWindowRepository;
import com.dinebooking.allocation.domain.service.BlackoutService;
import com.dinebooking.allocation.domain.service.ReservationCommandService;
import com.dinebooking.common.exception.BusinessException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * End-to-end commit protocol on H2: concurrent commits, idempotent replay over HTTP,
 * discovery and blackout side effects.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class ReservationFlowIntegrationTest {

    private static final String DATE = "2030-03-15";

    @Autowired
    private MockMvc mockMvc;
    @Autowired
    private ReservationCommandService commandService;
    @Autowired
    private BlackoutService blackoutService;
    @Autowired
    private InProcessLockCoordinator lockCoordinator;
    @Autowired
    private AllocationMetrics metrics;
    @Autowired
    private RestaurantRepository restaurantRepository;
    @Autowired
    private SectorRepository sectorRepository;
    @Autowired
    private DiningTableRepository tableRepository;
    @Autowired
    private ServiceWindowRepository serviceWindowRepository;
    @Autowired
    private ReservationRepository reservationRepository;
    @Autowired
    private BlackoutRepository blackoutRepository;

    @BeforeEach
    void seed() {
        restaurantRepository.save(Restaurant.builder()
                .id("R1").name("Bistro").timezone("America/Argentina/Buenos_Aires").build());
        serviceWindowRepository.save(ServiceWindow.builder().restaurantId("R1").startTime("12:00").endTime("16:00").build());
        serviceWindowRepository.save(ServiceWindow.builder().restaurantId("R1").startTime("20:00").endTime("23:45").build());
        sectorRepository.save(Sector.builder().id("S1").restaurantId("R1").name("Main Hall").build());
        sectorRepository.save(Sector.builder().id("S2").restaurantId("R1").name("Bar").build());
        table("T1", "S1", 2, 2);
        table("T2", "S1", 2, 4);
        table("T3", "S1", 2, 4);
        table("T4", "S1", 4, 6);
        table("T5", "S1", 2, 2);
        table("T9", "S2", 2, 2);
    }

    @AfterEach
    void cleanUp() {
        reservationRepository.deleteAll();
        blackoutRepository.deleteAll();
        tableRepository.deleteAll();
        sectorRepository.deleteAll();
        serviceWindowRepository.deleteAll();
        restaurantRepository.deleteAll();
    }

    private void table(String id, String sectorId, int min, int max) {
        tableRepository.save(DiningTable.builder()
                .id(id).sectorId(sectorId).name("Table " + id).minCapacity(min).maxCapacity(max).build());
    }

    private static CreateReservationRequest barRequest() {
        return new CreateReservationRequest("R1", "S2", 2, 60, DATE, "20:00", "21:00");
    }

    @Test
    @DisplayName("two concurrent commits for the only free slot: exactly one succeeds")
    void noDoubleBookingUnderRace() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<ReservationResponse>> futures = new ArrayList<>();
        try {
            for (String key : List.of("race-a", "race-b")) {
                Callable<ReservationResponse> commit = () -> {
                    go.await();
                    return commandService.createReservation(key, barRequest());
                };
                futures.add(executor.submit(commit));
            }
            go.countDown();

            int succeeded = 0;
            List<String> failures = new ArrayList<>();
            for (Future<ReservationResponse> future : futures) {
                try {
                    future.get(10, TimeUnit.SECONDS);
                    succeeded++;
                } catch (ExecutionException e) {
                    assertThat(e.getCause()).isInstanceOf(BusinessException.class);
                    failures.add(((BusinessException) e.getCause()).getErrorCode());
                }
            }

            assertThat(succeeded).isEqualTo(1);
            assertThat(failures).hasSize(1);
            assertThat(failures.get(0)).isIn("no_capacity", "table_locked");
            assertThat(reservationRepository.findAll()).hasSize(1);
            assertThat(lockCoordinator.activeKeyCount()).isZero();
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("concurrent commits with different starts never overlap on the same table")
    void noDoubleBookingAcrossDifferentStarts() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            for (int day = 1; day <= 10; day++) {
                String date = String.format("2030-04-%02d", day);
                CountDownLatch go = new CountDownLatch(1);
                List<Future<ReservationResponse>> futures = new ArrayList<>();
                for (String[] window : List.of(new String[] {"early", "20:00"}, new String[] {"late", "20:30"})) {
                    CreateReservationRequest request =
                            new CreateReservationRequest("R1", "S2", 2, 60, date, window[1], "23:00");
                    Callable<ReservationResponse> commit = () -> {
                        go.await();
                        return commandService.createReservation(window[0] + "-" + date, request);
                    };
                    futures.add(executor.submit(commit));
                }
                go.countDown();

                for (Future<ReservationResponse> future : futures) {
                    try {
                        future.get(10, TimeUnit.SECONDS);
                    } catch (ExecutionException e) {
                        assertThat(e.getCause()).isInstanceOf(BusinessException.class);
                        assertThat(((BusinessException) e.getCause()).getErrorCode())
                                .isIn("no_capacity", "table_locked");
                    }
                }
            }

            List<Reservation> confirmed = reservationRepository.findAll().stream()
                    .filter(r -> r.getStatus() == ReservationStatus.CONFIRMED)
                    .toList();
            assertThat(confirmed).hasSizeGreaterThanOrEqualTo(10);
            for (Reservation a : confirmed) {
                for (Reservation b : confirmed) {
                    if (a != b) {
                        boolean overlap = a.getStartsAt().isBefore(b.getEndsAt()) && b.getStartsAt().isBefore(a.getEndsAt());
                        assertThat(overlap).as("%s [%s, %s) vs %s [%s, %s)",
                                a.getId(), a.getStartsAt(), a.getEndsAt(),
                                b.getId(), b.getStartsAt(), b.getEndsAt()).isFalse();
                    }
                }
            }
            assertThat(lockCoordinator.activeKeyCount()).isZero();
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("retry with the same key replays the reservation; cancel is idempotent")
    void httpCommitReplayAndCancel() throws Exception {
        String body = """
                {"restaurantId":"R1","sectorId":"S1","partySize":2,"durationMinutes":60,
                 "date":"2030-03-15","windowStart":"20:00","windowEnd":"23:45"}
                """;

        String first = mockMvc.perform(post("/api/v1/allocation/reservations")
                        .header("Idempotency-Key", "http-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.tableIds[0]").value("T1"))
                .andExpect(jsonPath("$.data.start").value("2030-03-15T23:00:00Z"))
                .andReturn().getResponse().getContentAsString();
        String id = first.replaceAll(".*\"id\":\"(RES_[0-9A-F]{8})\".*", "$1");
        assertThat(id).matches("RES_[0-9A-F]{8}");

        mockMvc.perform(post("/api/v1/allocation/reservations")
                        .header("Idempotency-Key", "http-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.id").value(id));
        assertThat(reservationRepository.findAll()).hasSize(1);

        mockMvc.perform(get("/api/v1/allocation/reservations/day")
                        .param("restaurantId", "R1").param("sectorId", "S1").param("date", DATE))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.date").value(DATE))
                .andExpect(jsonPath("$.data.items[0].id").value(id));

        mockMvc.perform(delete("/api/v1/allocation/reservations/" + id)).andExpect(status().isNoContent());
        mockMvc.perform(delete("/api/v1/allocation/reservations/" + id)).andExpect(status().isNoContent());
        mockMvc.perform(get("/api/v1/allocation/reservations/" + id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("CANCELLED"));
    }

    @Test
    @DisplayName("metrics count commits and conflicts and are served over HTTP and actuator")
    void metricsExposed() throws Exception {
        long createdBefore = metrics.snapshot().reservationsCreated();
        long noCapacityBefore = metrics.snapshot().noCapacityConflicts();

        commandService.createReservation("metrics-1", barRequest());
        assertThatThrownBy(() -> commandService.createReservation("metrics-2", barRequest()))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode").isEqualTo("no_capacity");

        assertThat(metrics.snapshot().reservationsCreated()).isEqualTo(createdBefore + 1);
        assertThat(metrics.snapshot().noCapacityConflicts()).isEqualTo(noCapacityBefore + 1);

        mockMvc.perform(get("/api/v1/allocation/metrics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.reservationsCreated").value((int) (createdBefore + 1)))
                .andExpect(jsonPath("$.data.assignmentTime.samples").exists())
                .andExpect(jsonPath("$.data.lockWait.samples").exists());

        mockMvc.perform(get("/actuator/metrics/allocation.reservations.created"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("allocation.reservations.created"));
    }

    @Test
    @DisplayName("discovery skips a table booked 20:30-21:15 and offers T1 at 20:00")
    void discoveryAroundExistingBooking() throws Exception {
        reservationRepository.save(Reservation.builder()
                .id("RES_B1")
                .restaurantId("R1")
                .sectorId("S1")
                .tableIds(new ArrayList<>(List.of("T2")))
                .partySize(3)
                .startsAt(Instant.parse("2030-03-15T23:30:00Z"))
                .endsAt(Instant.parse("2030-03-16T00:15:00Z"))
                .durationMinutes(45)
                .status(ReservationStatus.CONFIRMED)
                .build());

        mockMvc.perform(get("/api/v1/allocation/discover")
                        .param("restaurantId", "R1").param("sectorId", "S1").param("date", DATE)
                        .param("partySize", "2").param("duration", "60")
                        .param("windowStart", "20:00").param("windowEnd", "23:45"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.slotMinutes").value(15))
                .andExpect(jsonPath("$.data.candidates[0].kind").value("single"))
                .andExpect(jsonPath("$.data.candidates[0].tableIds[0]").value("T1"))
                .andExpect(jsonPath("$.data.candidates[0].start").value("2030-03-15T23:00:00Z"));

        mockMvc.perform(get("/api/v1/allocation/discover")
                        .param("restaurantId", "R1").param("sectorId", "S1").param("date", DATE)
                        .param("partySize", "2").param("duration", "60")
                        .param("windowStart", "17:00").param("windowEnd", "19:00"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.errorCode").value("outside_service_window"));
    }

    @Test
    @DisplayName("a sector blackout cancels the reservations it covers and blocks new ones")
    void blackoutCancelsAndBlocks() {
        ReservationResponse booked = commandService.createReservation("bar-1", barRequest());

        CreateBlackoutResponse blackout = blackoutService.createBlackout(new CreateBlackoutRequest(
                "R1", "S2", List.of(), DATE, "19:00", "22:00", BlackoutReason.PRIVATE_EVENT, "Launch party"));

        assertThat(blackout.cancelledReservationIds()).containsExactly(booked.id());
        assertThat(reservationRepository.findById(booked.id()).orElseThrow().getStatus())
                .isEqualTo(ReservationStatus.CANCELLED);
        assertThat(blackoutService.listBlackouts("R1", "S2", DATE)).hasSize(1);

        assertThatThrownBy(
                        () -> commandService.createReservation("bar-2", barRequest()))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode").isEqualTo("no_capacity");
    }
}
