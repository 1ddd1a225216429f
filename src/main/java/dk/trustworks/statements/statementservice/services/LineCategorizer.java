package dk.trustworks.statements.statementservice.services;

import dk.trustworks.statements.statementservice.model.CategorizedLine;
import dk.trustworks.statements.statementservice.model.CategoryKind;
import dk.trustworks.statements.statementservice.model.DetailType;
import dk.trustworks.statements.statementservice.model.TransactionLine;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Assigns a category to a transaction line. Rules are tried in order; the first label wins,
 * otherwise the kind's default label is used. Never fails on missing data.
 *
 * <ul>
 *     <li>revenue: sold item name</li>
 *     <li>expense: expense account name, then purchased item name</li>
 * </ul>
 */
@ApplicationScoped
public class LineCategorizer {

    private final Map<CategoryKind, List<CategoryRule>> rules = new EnumMap<>(CategoryKind.class);

    public LineCategorizer() {
        rules.put(CategoryKind.REVENUE, List.of(
                CategoryRule.referenceName(DetailType.SALES_ITEM)));
        rules.put(CategoryKind.EXPENSE, List.of(
                CategoryRule.referenceName(DetailType.ACCOUNT_EXPENSE),
                CategoryRule.referenceName(DetailType.ITEM_EXPENSE)));
    }

    public CategorizedLine categorize(TransactionLine line, CategoryKind kind) {
        for (CategoryRule rule : rules.get(kind)) {
            Optional<String> label = rule.resolve(line);
            if (label.isPresent()) {
                return new CategorizedLine(label.get(), line.amountOrZero(), false);
            }
        }
        return new CategorizedLine(kind.getDefaultLabel(), line.amountOrZero(), true);
    }
}
