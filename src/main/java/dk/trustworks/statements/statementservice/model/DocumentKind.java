package dk.trustworks.statements.statementservice.model;

public enum DocumentKind {
    INVOICE(CategoryKind.REVENUE),
    BILL(CategoryKind.EXPENSE);

    private final CategoryKind categoryKind;

    DocumentKind(CategoryKind categoryKind) {
        this.categoryKind = categoryKind;
    }

    public CategoryKind getCategoryKind() {
        return categoryKind;
    }
}
