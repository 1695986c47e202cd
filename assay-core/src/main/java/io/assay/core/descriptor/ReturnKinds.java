package io.assay.core.descriptor;

import java.util.concurrent.CompletionStage;
import java.util.concurrent.Future;

/// Classifies test method return types.
public final class ReturnKinds {

    private ReturnKinds() {}

    /// Returns whether a method returning `returnType` completes asynchronously.
    ///
    /// @param returnType declared return type, not null
    /// @return true for `CompletionStage` and `Future` types
    public static boolean isAsync(Class<?> returnType) {
        return CompletionStage.class.isAssignableFrom(returnType)
                || Future.class.isAssignableFrom(returnType);
    }
}
