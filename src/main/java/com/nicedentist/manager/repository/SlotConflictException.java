package com.nicedentist.manager.repository;

import java.time.LocalDateTime;

/**
 * Raised by a store when an insert would double-book a customer or a dentist.
 */
public class SlotConflictException extends RuntimeException {

    public enum Party { CUSTOMER, DENTIST }

    private final Party party;
    private final LocalDateTime dateTime;

    public SlotConflictException(Party party, Long partyId, LocalDateTime dateTime) {
        super(party.name().toLowerCase() + " " + partyId + " already has an appointment at " + dateTime);
        this.party = party;
        this.dateTime = dateTime;
    }

    public Party getParty() {
        return party;
    }

    public LocalDateTime getDateTime() {
        return dateTime;
    }
}
