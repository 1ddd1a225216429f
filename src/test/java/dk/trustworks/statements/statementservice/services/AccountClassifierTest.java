package dk.trustworks.statements.statementservice.services;

import dk.trustworks.statements.statementservice.model.AccountClassification;
import dk.trustworks.statements.statementservice.model.Section;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class AccountClassifierTest {

    private final AccountClassifier classifier = new AccountClassifier();

    @ParameterizedTest(name = "{0} → {1}")
    @CsvSource({
            "Bank, ASSET",
            "Accounts Receivable, ASSET",
            "AccountsReceivable, ASSET",
            "Other Current Asset, ASSET",
            "Fixed Asset, ASSET",
            "Accounts Payable, LIABILITY",
            "Credit Card, LIABILITY",
            "Other Current Liability, LIABILITY",
            "Long Term Liability, LIABILITY",
            "Equity, EQUITY",
            "Income, UNCLASSIFIED",
            "Cost of Goods Sold, UNCLASSIFIED"
    })
    void sections(String tag, Section expected) {
        assertEquals(expected, classifier.classify(tag).section());
    }

    @Test
    @DisplayName("Tag spellings share one subgroup label")
    void subgroupLabels() {
        assertEquals("Accounts Receivable", classifier.classify("AccountsReceivable").subgroup());
        assertEquals("Accounts Receivable", classifier.classify("accounts_receivable").subgroup());
        assertEquals("Accounts Receivable", classifier.classify("Accounts Receivable").subgroup());
        assertEquals("Bank", classifier.classify("bank").subgroup());
    }

    @Test
    @DisplayName("Missing tag → unclassified, unspecified subgroup")
    void missingTag() {
        AccountClassification classification = classifier.classify(null);

        assertEquals(Section.UNCLASSIFIED, classification.section());
        assertEquals("Unspecified", classification.subgroup());
        assertEquals(classification, classifier.classify("  "));
    }

    @Test
    @DisplayName("Unknown tag keeps its own subgroup label")
    void unknownTag() {
        AccountClassification classification = classifier.classify("Suspense");

        assertEquals(Section.UNCLASSIFIED, classification.section());
        assertEquals("Suspense", classification.subgroup());
    }
}
