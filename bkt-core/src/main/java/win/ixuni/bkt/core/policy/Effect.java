package win.ixuni.bkt.core.policy;

/**
 * Statement effect
 */
public enum Effect {

    ALLOW("Allow"),
    DENY("Deny");

    private final String value;

    Effect(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Exact, case-sensitive match
     *
     * @return the effect, or null when the value is neither "Allow" nor "Deny"
     */
    public static Effect fromValue(String value) {
        for (Effect effect : values()) {
            if (effect.value.equals(value)) {
                return effect;
            }
        }
        return null;
    }
}
