package pass;

import java.util.function.Function;

/**
 * pass type factory
 */
public interface PassType<T extends Pass> {
    /* constructor, bound to the pipeline's context */
    Function<PassContext, T> constructor();

    /** default factory method: constructor().apply(context) */
    default T create(PassContext context) {
        return constructor().apply(context);
    }

    /** get the enum name */
    default String getName() {
        return ((Enum<?>) this).name().toLowerCase();
    }
}
