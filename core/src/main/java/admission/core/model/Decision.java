package admission.core.model;

public enum Decision {
    ADMIT,
    REJECT
}
