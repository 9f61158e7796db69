package com.example.paylog.extraction;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FinancialContextDetectorTest {

    private final FinancialContextDetector detector = new FinancialContextDetector();

    @Test
    void bankDebitMessageIsFinancial() {
        String sms = "Your account XXXXXX1234 has been debited with Rs.1,500.00";

        assertThat(detector.isFinancial(sms)).isTrue();
        // debit, amount and account categories; no credit keyword
        assertThat(detector.score(sms)).isEqualTo(0.75);
        assertThat(detector.matchedKeywords(sms)).contains("debited", "rs.", "account");
    }

    @Test
    void messageWithoutKeywordsIsNotFinancial() {
        String sms = "Hey, are we meeting for lunch tomorrow?";

        assertThat(detector.isFinancial(sms)).isFalse();
        assertThat(detector.score(sms)).isZero();
        assertThat(detector.matchedKeywords(sms)).isEmpty();
    }

    @Test
    void emptyAndWhitespaceAreNeverFinancial() {
        assertThat(detector.isFinancial("")).isFalse();
        assertThat(detector.isFinancial("   \n\t")).isFalse();
        assertThat(detector.score("")).isZero();
        assertThat(detector.score("    ")).isZero();
    }

    @Test
    void allFourCategoriesScoreOne() {
        String sms = "Rs.500 credited to your account and debited from card";

        assertThat(detector.score(sms)).isEqualTo(1.0);
    }

    @Test
    void matchingIsCaseInsensitive() {
        assertThat(detector.isFinancial("AMOUNT CREDITED")).isTrue();
        assertThat(detector.score("AMOUNT CREDITED")).isEqualTo(0.5);
    }
}
