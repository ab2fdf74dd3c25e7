package ai.policy.revision.model;

/**
 * Hands out sequential integer ids.
 */
final class IdAllocator {

    private int next;

    IdAllocator(int first) {
        this.next = first;
    }

    int next() {
        return next++;
    }

    /**
     * Ensures every id handed out from now on is greater than {@code taken}.
     */
    void reserveAbove(int taken) {
        if (taken >= next) {
            next = taken + 1;
        }
    }
}
