package io.shieldedchain.core.consensus;

public final class ValidationResult {
    private static final ValidationResult OK = new ValidationResult(true, null, null);

    public final boolean ok;
    public final RejectionReason reason;
    public final String message;

    private ValidationResult(boolean ok, RejectionReason reason, String message) {
        this.ok = ok; this.reason = reason; this.message = message;
    }
    public static ValidationResult ok() { return OK; }
    public static ValidationResult invalid(RejectionReason r, String msg) { return new ValidationResult(false, r, msg); }

    @Override public String toString() {
        return ok ? "OK" : ("ERR["+reason.code()+"]: "+message);
    }
}
