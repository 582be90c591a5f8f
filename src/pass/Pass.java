package pass;

public interface Pass extends AutoCloseable {

    /**
     * One full traversal of the unit. Rewrites found on the way are applied
     * together once the walk is over.
     * @return whether any substitution was applied
     */
    boolean run();

    /**
     * Request cooperative cancellation. The signal is shared by every pass of
     * the pipeline, so the whole fixpoint loop winds down.
     */
    void stop();

    boolean stopped();

    /** Release solver resources. */
    @Override
    default void close() {
    }

    public interface ASTPass extends Pass {
        ASTPassType getType();
    }
}
