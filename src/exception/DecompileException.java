package exception;

/**
 * Fatal inconsistency in the tree handed to the structuring passes.
 * Raised only for broken preconditions; a rewrite that cannot be proved is
 * never reported through this type.
 */
public class DecompileException extends RuntimeException {
    public DecompileException(String message) {
        super(message);
    }

    public DecompileException(String message, Throwable cause) {
        super(message, cause);
    }

    public static DecompileException fieldCountMismatch(String record, int declared, int debug) {
        return new DecompileException("Field count mismatch in " + record
                + ": declaration has " + declared + ", debug info has " + debug);
    }

    public static DecompileException unSupported(String msg) {
        return new DecompileException("UnSupported: " + msg);
    }

    public static DecompileException illegalNode(String msg) {
        return new DecompileException("Illegal node: " + msg);
    }

    public static DecompileException illegalSubstitution(String msg) {
        return new DecompileException("Illegal substitution: " + msg);
    }
}
