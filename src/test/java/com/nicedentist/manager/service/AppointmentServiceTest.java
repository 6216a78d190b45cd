package com.nicedentist.manager.service;

import com.nicedentist.manager.TestClocks;
import com.nicedentist.manager.dto.AppointmentFilter;
import com.nicedentist.manager.dto.PagedResult;
import com.nicedentist.manager.dto.ServiceResult;
import com.nicedentist.manager.entity.Appointment;
import com.nicedentist.manager.entity.AppointmentStatus;
import com.nicedentist.manager.entity.Customer;
import com.nicedentist.manager.entity.Dentist;
import com.nicedentist.manager.repository.AppointmentStore;
import com.nicedentist.manager.repository.CustomerRepository;
import com.nicedentist.manager.repository.DentistRepository;
import com.nicedentist.manager.repository.InMemoryAppointmentStore;
import com.nicedentist.manager.repository.SlotConflictException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.CannotAcquireLockException;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.nicedentist.manager.TestClocks.NEXT_TUESDAY_10;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

final class AppointmentServiceTest {

    private static final LocalDate SATURDAY = LocalDate.of(2030, 1, 12);

    private InMemoryAppointmentStore store;
    private SlotService slotService;
    private CustomerRepository customerRepository;
    private DentistRepository dentistRepository;
    private NotificationSender notificationSender;
    private AppointmentService service;

    private Customer jane;
    private Customer bob;
    private Dentist ana;
    private Dentist paulo;

    @BeforeEach
    void setUp() {
        store = new InMemoryAppointmentStore(TestClocks.fixed());
        slotService = new SlotService(store, TestClocks.fixed(), LocalTime.of(8, 0), LocalTime.of(18, 0), 30);
        customerRepository = mock(CustomerRepository.class);
        dentistRepository = mock(DentistRepository.class);
        notificationSender = mock(NotificationSender.class);
        service = newService(store, false);

        jane = Customer.builder().id(1L).name("Jane Roe").email("jane@example.com").phone("555-1").active(true).build();
        bob = Customer.builder().id(2L).name("Bob Poe").email("bob@example.com").phone("555-2").active(true).build();
        ana = Dentist.builder().id(1L).name("Dr. Ana Lima").email("ana@nicedentist.com").licenseNumber("L-1").active(true).build();
        paulo = Dentist.builder().id(2L).name("Dr. Paulo Reis").email("paulo@nicedentist.com").licenseNumber("L-2").active(true).build();

        when(customerRepository.findById(1L)).thenReturn(Optional.of(jane));
        when(customerRepository.findById(2L)).thenReturn(Optional.of(bob));
        when(dentistRepository.findById(1L)).thenReturn(Optional.of(ana));
        when(dentistRepository.findById(2L)).thenReturn(Optional.of(paulo));
        when(dentistRepository.findByActiveTrueOrderByName()).thenReturn(List.of(ana, paulo));
        when(notificationSender.sendAppointmentConfirmation(anyString(), anyString(), anyString(), any(), anyString())).thenReturn(true);
        when(notificationSender.sendAppointmentCancellation(anyString(), anyString(), any(), anyString())).thenReturn(true);
    }

    private AppointmentService newService(AppointmentStore appointmentStore, boolean strict) {
        SlotService slots = appointmentStore == store
                ? slotService
                : new SlotService(appointmentStore, TestClocks.fixed(), LocalTime.of(8, 0), LocalTime.of(18, 0), 30);
        return new AppointmentService(appointmentStore, slots, customerRepository, dentistRepository, notificationSender, strict);
    }

    private Appointment book(long customerId, long dentistId, LocalDateTime at) {
        ServiceResult<Appointment> result = service.createAppointment(customerId, dentistId, at, "Cleaning", null);
        assertTrue(result.success(), result.message());
        return result.value();
    }

    // ---- create ----

    @Test
    void createBooksTheSlotAndSendsConfirmation() {
        ServiceResult<Appointment> result = service.createAppointment(1L, 1L, NEXT_TUESDAY_10, "Cleaning", "First visit");

        assertEquals(ServiceResult.Outcome.SUCCESS, result.outcome());
        assertEquals("Appointment created successfully.", result.message());
        Appointment created = result.value();
        assertNotNull(created.getId());
        assertEquals(AppointmentStatus.SCHEDULED, created.getStatus());
        assertEquals("First visit", created.getNotes());
        verify(notificationSender).sendAppointmentConfirmation(
                "jane@example.com", "Jane Roe", "Dr. Ana Lima", NEXT_TUESDAY_10, "Cleaning");
    }

    @Test
    void createRejectsNonPositiveIds() {
        ServiceResult<Appointment> result = service.createAppointment(0L, 1L, NEXT_TUESDAY_10, "Cleaning", "");

        assertEquals(ServiceResult.Outcome.INVALID, result.outcome());
        assertEquals("Invalid customer or dentist ID.", result.message());
        assertEquals("Invalid customer or dentist ID.",
                service.createAppointment(1L, -3L, NEXT_TUESDAY_10, "Cleaning", "").message());
    }

    @Test
    void createRequiresProcedureType() {
        ServiceResult<Appointment> result = service.createAppointment(1L, 1L, NEXT_TUESDAY_10, "  ", "");

        assertEquals(ServiceResult.Outcome.INVALID, result.outcome());
        assertEquals("Procedure type is required.", result.message());
    }

    @Test
    void createRejectsCalendarViolations() {
        assertEquals("Cannot schedule appointments in the past.",
                service.createAppointment(1L, 1L, TestClocks.NOW.minusHours(1), "Cleaning", "").message());
        assertEquals("Appointments can only be scheduled between 08:00 and 18:00.",
                service.createAppointment(1L, 1L, NEXT_TUESDAY_10.withHour(19), "Cleaning", "").message());
        assertEquals("Appointments cannot be scheduled on weekends.",
                service.createAppointment(1L, 1L, SATURDAY.atTime(10, 0), "Cleaning", "").message());
        assertTrue(store.getByCustomerId(1L).isEmpty());
    }

    @Test
    void createRequiresExistingActiveCustomerAndDentist() {
        assertEquals("Customer not found.", service.createAppointment(9L, 1L, NEXT_TUESDAY_10, "Cleaning", "").message());

        paulo.setActive(false);
        ServiceResult<Appointment> result = service.createAppointment(1L, 2L, NEXT_TUESDAY_10, "Cleaning", "");
        assertEquals(ServiceResult.Outcome.INVALID, result.outcome());
        assertEquals("Dentist not found.", result.message());
        assertEquals("Dentist not found.", service.createAppointment(1L, 9L, NEXT_TUESDAY_10, "Cleaning", "").message());
    }

    @Test
    void dentistCannotBeDoubleBooked() {
        book(1L, 1L, NEXT_TUESDAY_10);

        ServiceResult<Appointment> result = service.createAppointment(2L, 1L, NEXT_TUESDAY_10, "Whitening", "");

        assertEquals(ServiceResult.Outcome.CONFLICT, result.outcome());
        assertEquals("Dentist already has an appointment at this time.", result.message());
        assertEquals(1, store.getByDentistId(1L).size());
    }

    @Test
    void customerCannotBeInTwoChairsAtOnce() {
        book(1L, 1L, NEXT_TUESDAY_10);

        ServiceResult<Appointment> result = service.createAppointment(1L, 2L, NEXT_TUESDAY_10, "Whitening", "");

        assertEquals(ServiceResult.Outcome.CONFLICT, result.outcome());
        assertEquals("Customer already has an appointment at this time.", result.message());
    }

    @Test
    void cancelledSlotCanBeBookedAgain() {
        Appointment first = book(1L, 1L, NEXT_TUESDAY_10);
        assertTrue(service.cancelAppointment(first.getId()).success());

        ServiceResult<Appointment> result = service.createAppointment(2L, 1L, NEXT_TUESDAY_10, "Whitening", "");

        assertTrue(result.success());
        assertNotEquals(first.getId(), result.value().getId());
    }

    @Test
    void emailFailureDoesNotUndoTheBooking() {
        when(notificationSender.sendAppointmentConfirmation(anyString(), anyString(), anyString(), any(), anyString()))
                .thenThrow(new IllegalStateException("mail relay down"));

        ServiceResult<Appointment> result = service.createAppointment(1L, 1L, NEXT_TUESDAY_10, "Cleaning", "");

        assertTrue(result.success());
        assertTrue(store.getById(result.value().getId()).isPresent());
    }

    @Test
    void lostRaceAtTheStoreIsReportedAsConflict() {
        AppointmentStore racingStore = mock(AppointmentStore.class);
        when(racingStore.create(any())).thenThrow(
                new SlotConflictException(SlotConflictException.Party.DENTIST, 1L, NEXT_TUESDAY_10));
        AppointmentService racing = newService(racingStore, false);

        ServiceResult<Appointment> result = racing.createAppointment(1L, 1L, NEXT_TUESDAY_10, "Cleaning", "");

        assertEquals(ServiceResult.Outcome.CONFLICT, result.outcome());
        assertEquals("Dentist already has an appointment at this time.", result.message());
        verify(notificationSender, never()).sendAppointmentConfirmation(anyString(), anyString(), anyString(), any(), anyString());
    }

    @Test
    void databaseAbortOfALostRaceIsReportedAsConflict() {
        AppointmentStore racingStore = mock(AppointmentStore.class);
        when(racingStore.create(any())).thenThrow(new CannotAcquireLockException("could not serialize access"));
        // free when checked up front, taken once the concurrent booking has committed
        when(racingStore.hasDentistConflict(any(), any(), any())).thenReturn(false, true);
        AppointmentService racing = newService(racingStore, false);

        ServiceResult<Appointment> result = racing.createAppointment(1L, 1L, NEXT_TUESDAY_10, "Cleaning", "");

        assertEquals(ServiceResult.Outcome.CONFLICT, result.outcome());
        assertEquals("Dentist already has an appointment at this time.", result.message());
        verify(notificationSender, never()).sendAppointmentConfirmation(anyString(), anyString(), anyString(), any(), anyString());
    }

    @Test
    void databaseAbortWithNoVisibleHolderIsStillAConflict() {
        AppointmentStore racingStore = mock(AppointmentStore.class);
        when(racingStore.create(any())).thenThrow(new CannotAcquireLockException("could not serialize access"));
        AppointmentService racing = newService(racingStore, false);

        ServiceResult<Appointment> result = racing.createAppointment(1L, 1L, NEXT_TUESDAY_10, "Cleaning", "");

        assertEquals(ServiceResult.Outcome.CONFLICT, result.outcome());
        assertEquals("This time slot is no longer available.", result.message());
    }

    // ---- update ----

    @Test
    void updateOfUnknownAppointmentIsNotFound() {
        ServiceResult<Appointment> result = service.updateAppointment(42L, 1L, 1L, NEXT_TUESDAY_10, "Cleaning", "");

        assertEquals(ServiceResult.Outcome.NOT_FOUND, result.outcome());
        assertEquals("Appointment not found.", result.message());
    }

    @Test
    void updateKeepingTheTimeSkipsSlotChecks() {
        Appointment booked = book(1L, 1L, NEXT_TUESDAY_10);

        ServiceResult<Appointment> result = service.updateAppointment(
                booked.getId(), 1L, 1L, NEXT_TUESDAY_10, "Root canal", "Upper left");

        assertTrue(result.success());
        assertEquals("Appointment updated successfully.", result.message());
        Appointment stored = store.getById(booked.getId()).orElseThrow();
        assertEquals("Root canal", stored.getProcedureType());
        assertEquals("Upper left", stored.getNotes());
    }

    @Test
    void updateMovingIntoAnOccupiedSlotConflicts() {
        book(2L, 1L, NEXT_TUESDAY_10.plusHours(1));
        Appointment mine = book(1L, 1L, NEXT_TUESDAY_10);

        ServiceResult<Appointment> result = service.updateAppointment(
                mine.getId(), 1L, 1L, NEXT_TUESDAY_10.plusHours(1), "Cleaning", "");

        assertEquals(ServiceResult.Outcome.CONFLICT, result.outcome());
        assertEquals("Dentist already has an appointment at this time.", result.message());
        assertEquals(NEXT_TUESDAY_10, store.getById(mine.getId()).orElseThrow().getAppointmentDateTime());
    }

    @Test
    void updateRevalidatesANewTime() {
        Appointment mine = book(1L, 1L, NEXT_TUESDAY_10);

        ServiceResult<Appointment> result = service.updateAppointment(
                mine.getId(), 1L, 1L, SATURDAY.atTime(9, 0), "Cleaning", "");

        assertEquals(ServiceResult.Outcome.INVALID, result.outcome());
        assertEquals("Appointments cannot be scheduled on weekends.", result.message());
    }

    @Test
    void updateCanMoveToAFreeSlot() {
        Appointment mine = book(1L, 1L, NEXT_TUESDAY_10);

        ServiceResult<Appointment> result = service.updateAppointment(
                mine.getId(), 1L, 2L, NEXT_TUESDAY_10.plusMinutes(30), "Cleaning", "");

        assertTrue(result.success());
        assertTrue(slotService.isSlotAvailable(1L, NEXT_TUESDAY_10));
        assertFalse(slotService.isSlotAvailable(2L, NEXT_TUESDAY_10.plusMinutes(30)));
    }

    // ---- generic status update ----

    @Test
    void updateMovingToABusyDentistAtTheSameTimeConflicts() {
        book(1L, 1L, NEXT_TUESDAY_10);
        Appointment other = book(2L, 2L, NEXT_TUESDAY_10);

        ServiceResult<Appointment> result = service.updateAppointment(
                other.getId(), 2L, 1L, NEXT_TUESDAY_10, "Cleaning", "");

        assertEquals(ServiceResult.Outcome.CONFLICT, result.outcome());
        assertEquals("Dentist already has an appointment at this time.", result.message());
        assertEquals(2L, store.getById(other.getId()).orElseThrow().getDentistId());
        assertEquals(1, store.getByDentistIdAndDateRange(1L, NEXT_TUESDAY_10, NEXT_TUESDAY_10).size());
    }

    @Test
    void updateHandingTheSlotToABusyCustomerConflicts() {
        book(1L, 1L, NEXT_TUESDAY_10);
        Appointment other = book(2L, 2L, NEXT_TUESDAY_10);

        ServiceResult<Appointment> result = service.updateAppointment(
                other.getId(), 1L, 2L, NEXT_TUESDAY_10, "Cleaning", "");

        assertEquals(ServiceResult.Outcome.CONFLICT, result.outcome());
        assertEquals("Customer already has an appointment at this time.", result.message());
        assertEquals(2L, store.getById(other.getId()).orElseThrow().getCustomerId());
    }

    @Test
    void updateMovingToAFreeDentistAtTheSameTime() {
        Appointment mine = book(1L, 1L, NEXT_TUESDAY_10);

        ServiceResult<Appointment> result = service.updateAppointment(
                mine.getId(), 1L, 2L, NEXT_TUESDAY_10, "Cleaning", "");

        assertTrue(result.success(), result.message());
        assertTrue(slotService.isSlotAvailable(1L, NEXT_TUESDAY_10));
        assertFalse(slotService.isSlotAvailable(2L, NEXT_TUESDAY_10));
    }

    @Test
    void statusUpdateOverwritesByDefault() {
        Appointment booked = book(1L, 1L, NEXT_TUESDAY_10);
        service.completeAppointment(booked.getId());

        ServiceResult<Appointment> result = service.updateStatus(booked.getId(), AppointmentStatus.SCHEDULED, "entered by mistake");

        assertTrue(result.success());
        assertEquals(AppointmentStatus.SCHEDULED, store.getById(booked.getId()).orElseThrow().getStatus());
    }

    @Test
    void strictStatusUpdateRejectsTransitionsOutsideTheTable() {
        AppointmentService strict = newService(store, true);
        Appointment booked = book(1L, 1L, NEXT_TUESDAY_10);
        strict.completeAppointment(booked.getId());

        ServiceResult<Appointment> result = strict.updateStatus(booked.getId(), AppointmentStatus.SCHEDULED, "");

        assertEquals(ServiceResult.Outcome.INVALID_STATE, result.outcome());
        assertEquals(AppointmentStatus.COMPLETED, store.getById(booked.getId()).orElseThrow().getStatus());
        assertTrue(strict.updateStatus(booked.getId(), AppointmentStatus.COMPLETED, "").success());
    }

    @Test
    void statusUpdateOfUnknownAppointmentIsNotFound() {
        assertEquals(ServiceResult.Outcome.NOT_FOUND,
                service.updateStatus(5L, AppointmentStatus.CANCELLED, "").outcome());
    }

    // ---- lifecycle ----

    @Test
    void ownerCanRequestCancellation() {
        Appointment booked = book(1L, 1L, NEXT_TUESDAY_10);

        ServiceResult<Appointment> result = service.requestCancellation(booked.getId(), 1L);

        assertTrue(result.success());
        assertEquals("Cancellation request submitted successfully.", result.message());
        assertEquals(AppointmentStatus.CANCELLATION_REQUESTED, store.getById(booked.getId()).orElseThrow().getStatus());
        // a pending request still holds the slot
        assertFalse(slotService.isSlotAvailable(1L, NEXT_TUESDAY_10));
    }

    @Test
    void onlyTheOwnerCanRequestCancellation() {
        Appointment booked = book(1L, 1L, NEXT_TUESDAY_10);

        ServiceResult<Appointment> result = service.requestCancellation(booked.getId(), 2L);

        assertEquals(ServiceResult.Outcome.FORBIDDEN, result.outcome());
        assertEquals("You can only cancel your own appointments.", result.message());
        assertEquals(AppointmentStatus.SCHEDULED, store.getById(booked.getId()).orElseThrow().getStatus());
    }

    @Test
    void cancellationRequestNeedsAScheduledAppointment() {
        Appointment booked = book(1L, 1L, NEXT_TUESDAY_10);
        service.requestCancellation(booked.getId(), 1L);

        ServiceResult<Appointment> again = service.requestCancellation(booked.getId(), 1L);

        assertEquals(ServiceResult.Outcome.INVALID_STATE, again.outcome());
        assertEquals("Only scheduled appointments can be cancelled.", again.message());
        assertEquals(ServiceResult.Outcome.NOT_FOUND, service.requestCancellation(77L, 1L).outcome());
    }

    @Test
    void cancelApprovesAPendingRequestAndNotifiesTheCustomer() {
        Appointment booked = book(1L, 1L, NEXT_TUESDAY_10);
        service.requestCancellation(booked.getId(), 1L);

        ServiceResult<Appointment> result = service.cancelAppointment(booked.getId());

        assertTrue(result.success());
        assertEquals("Appointment cancelled successfully.", result.message());
        assertEquals(AppointmentStatus.CANCELLED, result.value().getStatus());
        verify(notificationSender).sendAppointmentCancellation("jane@example.com", "Jane Roe", NEXT_TUESDAY_10, "Cleaning");
    }

    @Test
    void cancellingTwiceIsHarmless() {
        Appointment booked = book(1L, 1L, NEXT_TUESDAY_10);
        service.cancelAppointment(booked.getId());

        ServiceResult<Appointment> again = service.cancelAppointment(booked.getId());

        assertTrue(again.success());
        assertEquals("Appointment is already cancelled.", again.message());
        verify(notificationSender, times(1)).sendAppointmentCancellation(anyString(), anyString(), any(), anyString());
    }

    @Test
    void completedAppointmentsCannotBeCancelled() {
        Appointment booked = book(1L, 1L, NEXT_TUESDAY_10);
        service.completeAppointment(booked.getId());

        ServiceResult<Appointment> result = service.cancelAppointment(booked.getId());

        assertEquals(ServiceResult.Outcome.INVALID_STATE, result.outcome());
        assertEquals("Cannot cancel completed appointments.", result.message());
        assertEquals(ServiceResult.Outcome.NOT_FOUND, service.cancelAppointment(123L).outcome());
    }

    @Test
    void cancelEmailFailureStillCancels() {
        Appointment booked = book(1L, 1L, NEXT_TUESDAY_10);
        when(notificationSender.sendAppointmentCancellation(anyString(), anyString(), any(), anyString()))
                .thenThrow(new IllegalStateException("mail relay down"));

        assertTrue(service.cancelAppointment(booked.getId()).success());
        assertEquals(AppointmentStatus.CANCELLED, store.getById(booked.getId()).orElseThrow().getStatus());
    }

    @Test
    void completeOnlyFromScheduled() {
        Appointment booked = book(1L, 1L, NEXT_TUESDAY_10);

        ServiceResult<Appointment> done = service.completeAppointment(booked.getId());
        assertTrue(done.success());
        assertEquals("Appointment marked as completed.", done.message());

        ServiceResult<Appointment> again = service.completeAppointment(booked.getId());
        assertEquals(ServiceResult.Outcome.INVALID_STATE, again.outcome());
        assertEquals("Only scheduled appointments can be completed.", again.message());

        Appointment other = book(2L, 2L, NEXT_TUESDAY_10);
        service.requestCancellation(other.getId(), 2L);
        assertEquals(ServiceResult.Outcome.INVALID_STATE, service.completeAppointment(other.getId()).outcome());
    }

    @Test
    void rejectingACancellationRequestRestoresTheBooking() {
        Appointment booked = book(1L, 1L, NEXT_TUESDAY_10);
        service.requestCancellation(booked.getId(), 1L);

        ServiceResult<Appointment> result = service.updateStatus(booked.getId(), AppointmentStatus.SCHEDULED, "declined");

        assertTrue(result.success());
        assertTrue(service.completeAppointment(booked.getId()).success());
    }

    @Test
    void deleteReportsWhetherTheAppointmentExisted() {
        Appointment booked = book(1L, 1L, NEXT_TUESDAY_10);

        assertTrue(service.deleteAppointment(booked.getId()));
        assertFalse(service.deleteAppointment(booked.getId()));
        assertTrue(service.getAppointment(booked.getId()).isEmpty());
    }

    // ---- reads and availability ----

    @Test
    void readsByPartyAndFilter() {
        book(1L, 1L, NEXT_TUESDAY_10);
        book(1L, 2L, NEXT_TUESDAY_10.plusHours(1));
        book(2L, 2L, NEXT_TUESDAY_10);

        assertEquals(2, service.getAppointmentsByCustomer(1L).size());
        assertEquals(2, service.getAppointmentsByDentist(2L).size());

        PagedResult<Appointment> page = service.getAllAppointments(
                AppointmentFilter.builder().page(0).pageSize(500).dentistId(2L).build());
        assertEquals(1, page.page());
        assertEquals(100, page.pageSize());
        assertEquals(2, page.totalCount());
    }

    @Test
    void allAvailableSlotsCoversEveryActiveDentist() {
        book(1L, 1L, NEXT_TUESDAY_10);
        LocalDate tuesday = NEXT_TUESDAY_10.toLocalDate();

        Map<Long, List<LocalDateTime>> all = service.getAllAvailableSlots(tuesday, tuesday);

        assertEquals(List.of(1L, 2L), List.copyOf(all.keySet()));
        assertEquals(19, all.get(1L).size());
        assertEquals(20, all.get(2L).size());
        assertEquals(all.get(1L), service.getAvailableSlots(1L, tuesday, tuesday));
        assertFalse(service.isSlotAvailable(1L, NEXT_TUESDAY_10));
        assertTrue(service.isSlotAvailable(2L, NEXT_TUESDAY_10));
    }

    @Test
    void confirmationCarriesTheDentistName() {
        service.createAppointment(2L, 2L, NEXT_TUESDAY_10, "Whitening", "");

        verify(notificationSender).sendAppointmentConfirmation(
                eq("bob@example.com"), eq("Bob Poe"), eq("Dr. Paulo Reis"), eq(NEXT_TUESDAY_10), eq("Whitening"));
    }
}
