package com.example.cafeshift.common.concurrent;

import com.example.cafeshift.exception.ConflictException;
import org.springframework.dao.ConcurrencyFailureException;

import java.util.function.IntSupplier;

/**
 * Runs a guarded {@code UPDATE ... WHERE status = :expected} and turns "nobody matched" or a
 * database lock failure into a {@link ConflictException}.
 */
public final class ConditionalUpdates {

    private ConditionalUpdates() {
    }

    public static void require(IntSupplier update, String conflictMessage) {
        int rows;
        try {
            rows = update.getAsInt();
        } catch (ConcurrencyFailureException ex) {
            throw new ConflictException(conflictMessage, ex);
        }
        if (rows != 1) {
            throw new ConflictException(conflictMessage);
        }
    }
}
