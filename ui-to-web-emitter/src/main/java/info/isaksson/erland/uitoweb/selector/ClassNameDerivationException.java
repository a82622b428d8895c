package info.isaksson.erland.uitoweb.selector;

/** Raised by a {@link ClassNameDeriver} that cannot produce class names for a node. */
public class ClassNameDerivationException extends Exception {

    public ClassNameDerivationException(String message) {
        super(message);
    }

    public ClassNameDerivationException(String message, Throwable cause) {
        super(message, cause);
    }
}
