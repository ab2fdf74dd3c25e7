package ai.policy.revision.revision;

/**
 * Requested size of a substituted image in millimetres. A zero dimension is derived from the
 * other one using the picture's aspect ratio.
 */
public record SizeConstraint(double widthMm, double heightMm) {

    static final long EMU_PER_MM = 36_000L;

    /** Logo default: 6 mm tall, width from the aspect ratio. */
    public static final SizeConstraint DEFAULT_LOGO = new SizeConstraint(0, 6);

    public SizeConstraint {
        if (Double.isNaN(widthMm) || Double.isNaN(heightMm) || widthMm < 0 || heightMm < 0) {
            throw new IllegalArgumentException("image size must not be negative");
        }
        if (widthMm == 0 && heightMm == 0) {
            throw new IllegalArgumentException("image width and height cannot both be zero");
        }
    }

    /**
     * Resolves the extent in EMU for a picture of {@code widthPx} by {@code heightPx}.
     */
    public long[] toEmu(int widthPx, int heightPx) {
        if (widthPx <= 0 || heightPx <= 0) {
            throw new IllegalArgumentException("pixel dimensions must be positive");
        }
        double width = widthMm;
        double height = heightMm;
        if (height == 0) {
            height = width * heightPx / widthPx;
        } else if (width == 0) {
            width = height * widthPx / heightPx;
        }
        long widthEmu = Math.max(1L, Math.round(width * EMU_PER_MM));
        long heightEmu = Math.max(1L, Math.round(height * EMU_PER_MM));
        return new long[] {widthEmu, heightEmu};
    }
}
