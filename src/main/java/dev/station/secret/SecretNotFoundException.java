package dev.station.secret;

/**
 * A step asked for a secret that is not declared for the current run.
 * Not an infrastructure failure: the step may handle it.
 */
public class SecretNotFoundException extends RuntimeException {

    private final String name;

    public SecretNotFoundException(String name) {
        super("No secret declared with name: '" + name + "'");
        this.name = name;
    }

    public String getName() { return name; }
}
