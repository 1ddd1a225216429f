package dk.trustworks.statements.statementservice.model;

/**
 * What a transaction line refers to. Exactly one variant per line; {@link NoDetail} when the
 * ledger sent none of the known detail payloads.
 */
public interface LineDetail {

    DetailType type();

    /**
     * @return the referenced item or account, may be null even when the detail is present
     */
    Reference reference();

    static LineDetail none() {
        return NoDetail.INSTANCE;
    }

    /** Sold item on an invoice line. */
    record SalesItemDetail(Reference reference) implements LineDetail {
        @Override
        public DetailType type() {
            return DetailType.SALES_ITEM;
        }
    }

    /** Bill line booked directly against an expense account. */
    record AccountExpenseDetail(Reference reference) implements LineDetail {
        @Override
        public DetailType type() {
            return DetailType.ACCOUNT_EXPENSE;
        }
    }

    /** Bill line for a purchased item. */
    record ItemExpenseDetail(Reference reference) implements LineDetail {
        @Override
        public DetailType type() {
            return DetailType.ITEM_EXPENSE;
        }
    }

    record NoDetail() implements LineDetail {
        static final NoDetail INSTANCE = new NoDetail();

        @Override
        public DetailType type() {
            return DetailType.NONE;
        }

        @Override
        public Reference reference() {
            return null;
        }
    }
}
