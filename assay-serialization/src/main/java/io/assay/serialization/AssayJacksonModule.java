package io.assay.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.assay.core.result.FailureDetail;
import io.assay.core.result.OutcomeRecord;
import io.assay.serialization.mixin.FailureDetailMixin;
import io.assay.serialization.mixin.OutcomeRecordMixin;
import java.io.Serial;

/// Jackson `SimpleModule` that registers all Assay serialization configuration in one place.
///
/// Both registered types are records, so Jackson binds them through their canonical
/// constructors; the mixins only shape the JSON (property order, omitted nulls):
/// - `OutcomeRecord` + `OutcomeRecordMixin`
/// - `FailureDetail` + `FailureDetailMixin`
///
/// @implNote All registrations are explicit; no classpath scanning.
/// @see OutcomeRecordSerializer for the convenience factory API
public class AssayJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 5196245430735612208L;

    public AssayJacksonModule() {
        super("AssayJacksonModule");
    }

    /// Applies the mixins.
    ///
    /// @param context the setup context provided by Jackson, not null
    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(OutcomeRecord.class, OutcomeRecordMixin.class);
        context.setMixInAnnotations(FailureDetail.class, FailureDetailMixin.class);
    }
}
