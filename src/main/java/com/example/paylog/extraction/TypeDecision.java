package com.example.paylog.extraction;

import com.example.paylog.model.TransactionType;
import lombok.Value;

import java.util.List;

/**
 * Debit/credit classification together with how it was reached.
 */
@Value
public class TypeDecision {

    public enum TieBreak {
        /** Only one side matched, or neither. */
        NONE,
        /** Both matched; the side whose keyword sits closest to the amount won. */
        AMOUNT_PROXIMITY,
        /** Both matched; the side with more distinct keywords won. */
        MATCH_COUNT,
        /** Both matched evenly; the side mentioned first won. */
        FIRST_OCCURRENCE
    }

    TransactionType type;
    TieBreak tieBreak;
    List<String> debitMatches;
    List<String> creditMatches;

    public boolean isAmbiguous() {
        return !debitMatches.isEmpty() && !creditMatches.isEmpty();
    }
}
