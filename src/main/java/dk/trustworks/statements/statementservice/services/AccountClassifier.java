package dk.trustworks.statements.statementservice.services;

import dk.trustworks.statements.statementservice.model.AccountClassification;
import dk.trustworks.statements.statementservice.model.Section;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps a declared account type to its balance sheet section and a display subgroup.
 * Unknown types land in {@link Section#UNCLASSIFIED} so no account is dropped.
 */
@ApplicationScoped
public class AccountClassifier {

    static final String UNSPECIFIED_SUBGROUP = "Unspecified";

    // keys are normalized: lower case, no separators
    private static final Map<String, Section> SECTIONS = Map.of(
            "bank", Section.ASSET,
            "accountsreceivable", Section.ASSET,
            "othercurrentasset", Section.ASSET,
            "fixedasset", Section.ASSET,
            "accountspayable", Section.LIABILITY,
            "creditcard", Section.LIABILITY,
            "othercurrentliability", Section.LIABILITY,
            "longtermliability", Section.LIABILITY,
            "equity", Section.EQUITY);

    public AccountClassification classify(String accountTypeTag) {
        if (accountTypeTag == null || accountTypeTag.isBlank()) {
            return new AccountClassification(Section.UNCLASSIFIED, UNSPECIFIED_SUBGROUP);
        }
        Section section = SECTIONS.getOrDefault(key(accountTypeTag), Section.UNCLASSIFIED);
        return new AccountClassification(section, subgroupLabel(accountTypeTag));
    }

    static String key(String tag) {
        return tag.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
    }

    /**
     * "AccountsReceivable", "accounts_receivable" and "Accounts Receivable" all become "Accounts Receivable".
     */
    static String subgroupLabel(String tag) {
        String spaced = tag.trim()
                .replaceAll("([a-z0-9])([A-Z])", "$1 $2")
                .replaceAll("[_\\-\\s]+", " ");
        String label = Arrays.stream(spaced.split(" "))
                .filter(word -> !word.isEmpty())
                .map(word -> word.substring(0, 1).toUpperCase(Locale.ROOT) + word.substring(1).toLowerCase(Locale.ROOT))
                .collect(Collectors.joining(" "));
        return label.isEmpty() ? UNSPECIFIED_SUBGROUP : label;
    }
}
