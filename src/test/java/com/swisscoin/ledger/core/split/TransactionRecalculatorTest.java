package com.swisscoin.ledger.core.split;

import com.swisscoin.ledger.core.model.PayerContribution;
import com.swisscoin.ledger.core.model.SplitMethod;
import com.swisscoin.ledger.core.model.SplitShare;
import com.swisscoin.ledger.core.model.Transaction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static com.swisscoin.ledger.core.LedgerFixtures.bd;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TransactionRecalculator")
class TransactionRecalculatorTest {

    private final TransactionRecalculator recalculator = new TransactionRecalculator();
    private final SplitCalculator calculator = new SplitCalculator();

    private Transaction transaction(SplitMethod method, Map<String, BigDecimal> raw, String payerId,
                                    List<PayerContribution> payers) {
        SplitComputation split = calculator.computeSplits(bd("100.00"), method, List.of("a", "b", "c"), raw);
        return new Transaction("t1", "Dinner", bd("100.00"), "USD", 0L, method, payerId, payers,
                split.shares(), null, null, "a", false);
    }

    @Test
    @DisplayName("Should redo an equal split on the new total")
    void shouldRescaleEqualSplit() {
        Transaction t = transaction(SplitMethod.EQUAL, Map.of(), "a", List.of(new PayerContribution("a", bd("100.00"))));

        Transaction r = recalculator.rescale(t, bd("50"));

        assertThat(r.totalAmount()).isEqualByComparingTo("50.00");
        assertThat(r.splits()).extracting(s -> s.amount().toPlainString()).containsExactly("16.67", "16.67", "16.66");
        assertThat(r.payers()).singleElement().satisfies(p -> assertThat(p.amount()).isEqualByComparingTo("50"));
        assertThat(r.id()).isEqualTo("t1");
    }

    @Test
    @DisplayName("Should scale shares and payers proportionally")
    void shouldRescaleProportionally() {
        Transaction t = transaction(SplitMethod.SHARES, Map.of("a", bd("2"), "b", bd("1"), "c", bd("1")), "a",
                List.of(new PayerContribution("a", bd("60")), new PayerContribution("b", bd("40"))));

        Transaction r = recalculator.rescale(t, bd("200"));

        assertThat(r.splits()).extracting(SplitShare::amount).extracting(BigDecimal::toPlainString)
                .containsExactly("100.00", "50.00", "50.00");
        assertThat(r.splits().get(0).rawInput()).isEqualByComparingTo("2");
        assertThat(r.payers()).extracting(p -> p.amount().toPlainString()).containsExactly("120.00", "80.00");
    }

    @Test
    @DisplayName("Should rewrite exact amounts as their new raw input")
    void shouldUpdateExactRawInputs() {
        Transaction t = transaction(SplitMethod.AMOUNT, Map.of("a", bd("50"), "b", bd("30"), "c", bd("20")), "a", List.of());

        Transaction r = recalculator.rescale(t, bd("150"));

        assertThat(r.splits()).extracting(s -> s.rawInput().toPlainString()).containsExactly("75.00", "45.00", "30.00");
    }

    @Test
    @DisplayName("Should keep legacy single-payer records without payer rows")
    void shouldKeepLegacyPayer() {
        Transaction t = transaction(SplitMethod.EQUAL, Map.of(), "a", List.of());

        Transaction r = recalculator.rescale(t, bd("30"));

        assertThat(r.payers()).isEmpty();
        assertThat(r.effectivePayers()).singleElement()
                .satisfies(p -> assertThat(p.amount()).isEqualByComparingTo("30"));
    }

    @Test
    @DisplayName("Should reject a non-positive new total")
    void shouldRejectZero() {
        Transaction t = transaction(SplitMethod.EQUAL, Map.of(), "a", List.of());

        assertThatThrownBy(() -> recalculator.rescale(t, bd("0")))
                .isInstanceOf(InvalidSplitInputException.class);
    }
}
