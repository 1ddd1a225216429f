package dk.trustworks.statements.statementservice.model;

/**
 * @param subgroup display label for the section header row; not used for totals
 */
public record AccountClassification(Section section, String subgroup) {
}
