package ai.policy.revision.match;

/**
 * Character sequence that counts every character read by the regex engine and aborts the match
 * once the budget is spent.
 */
final class BudgetedCharSequence implements CharSequence {

    private final CharSequence delegate;
    private final Budget budget;

    BudgetedCharSequence(CharSequence delegate, Budget budget) {
        this.delegate = delegate;
        this.budget = budget;
    }

    @Override
    public int length() {
        return delegate.length();
    }

    @Override
    public char charAt(int index) {
        budget.spend();
        return delegate.charAt(index);
    }

    @Override
    public CharSequence subSequence(int start, int end) {
        return new BudgetedCharSequence(delegate.subSequence(start, end), budget);
    }

    @Override
    public String toString() {
        return delegate.toString();
    }

    static final class Budget {

        private final long limit;
        private long spent;

        Budget(long limit) {
            this.limit = limit;
        }

        void spend() {
            if (++spent > limit) {
                throw new PatternRejectedException("pattern exceeded its matching budget of " + limit + " steps");
            }
        }
    }
}
