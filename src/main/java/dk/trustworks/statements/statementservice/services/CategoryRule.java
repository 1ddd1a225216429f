package dk.trustworks.statements.statementservice.services;

import dk.trustworks.statements.statementservice.model.DetailType;
import dk.trustworks.statements.statementservice.model.Reference;
import dk.trustworks.statements.statementservice.model.TransactionLine;

import java.util.Optional;

/**
 * Resolves a category label from a transaction line, or declines.
 */
@FunctionalInterface
public interface CategoryRule {

    Optional<String> resolve(TransactionLine line);

    /**
     * Matches lines whose detail is of the given type and names its reference.
     * A matching detail with an unnamed reference declines.
     */
    static CategoryRule referenceName(DetailType type) {
        return line -> {
            if (line.detail().type() != type) return Optional.empty();
            Reference reference = line.detail().reference();
            return reference != null && reference.hasName() ? Optional.of(reference.name()) : Optional.empty();
        };
    }
}
