package com.compass.calendar.infrastructure.persistence;

import com.compass.calendar.domain.error.CalendarException;
import com.compass.calendar.domain.model.CalendarEvent;
import com.compass.calendar.domain.model.EventException;
import com.compass.calendar.domain.model.EventOccurrence;
import com.compass.calendar.domain.model.EventReminder;
import com.compass.calendar.domain.model.RecurrenceRule;
import com.compass.calendar.domain.port.out.CalendarTransaction;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionStatus;

/**
 * Thread-bound Spring transaction. Statements go through the repository's JdbcTemplate,
 * which joins the connection bound by the transaction manager.
 */
class JdbcCalendarTransaction implements CalendarTransaction {

    private static final Logger logger = LoggerFactory.getLogger(JdbcCalendarTransaction.class);

    private final JdbcCalendarRepository repository;
    private final PlatformTransactionManager transactionManager;
    private final TransactionStatus status;

    JdbcCalendarTransaction(JdbcCalendarRepository repository,
                            PlatformTransactionManager transactionManager,
                            TransactionStatus status) {
        this.repository = repository;
        this.transactionManager = transactionManager;
        this.status = status;
    }

    @Override
    public void createEvent(CalendarEvent event) {
        repository.createEvent(event);
    }

    @Override
    public void updateEvent(CalendarEvent event) {
        repository.updateEvent(event);
    }

    @Override
    public void createRecurrenceRule(RecurrenceRule rule) {
        repository.createRecurrenceRule(rule);
    }

    @Override
    public void createOccurrence(EventOccurrence occurrence) {
        repository.createOccurrence(occurrence);
    }

    @Override
    public void createReminder(EventReminder reminder) {
        repository.createReminder(reminder);
    }

    @Override
    public void createException(EventException exception) {
        repository.createException(exception);
    }

    @Override
    public void updateException(EventException exception) {
        repository.updateException(exception);
    }

    @Override
    public List<EventException> findExceptions(UUID eventId, Instant start, Instant end) {
        return repository.findExceptions(eventId, start, end);
    }

    @Override
    public void commit() {
        try {
            transactionManager.commit(status);
        } catch (TransactionException e) {
            logger.error("Transaction commit failed", e);
            throw CalendarException.transaction("Failed to commit transaction", e);
        }
    }

    @Override
    public void rollback() {
        if (status.isCompleted()) {
            return;
        }
        try {
            transactionManager.rollback(status);
        } catch (TransactionException e) {
            logger.error("Transaction rollback failed", e);
            throw CalendarException.transaction("Failed to roll back transaction", e);
        }
    }

    @Override
    public boolean isCompleted() {
        return status.isCompleted();
    }
}
