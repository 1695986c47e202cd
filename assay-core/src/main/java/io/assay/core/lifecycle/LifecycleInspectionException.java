package io.assay.core.lifecycle;

import java.io.Serial;

/// Thrown when a lifecycle binding is structurally invalid.
///
/// Raised while the registry resolves a class or module: a binding with the wrong
/// signature, a second binding for a role, or an unusable context slot. The
/// registry caches it on the affected state so every dependent case reports it.
public class LifecycleInspectionException extends Exception {

    @Serial private static final long serialVersionUID = 3170582694431259817L;

    public LifecycleInspectionException(String message) {
        super(message);
    }
}
