package com.storeradar.discovery.validation;

import com.storeradar.discovery.model.RejectionStage;
import com.storeradar.discovery.model.StoreMetadata;
import org.springframework.stereotype.Component;

/**
 * Last word: no positive product count, no record. Unknown counts are not defaulted.
 */
@Component
public class AcceptanceGate implements ValidationStage {

    @Override
    public String name() {
        return "acceptance";
    }

    @Override
    public StageResult apply(ValidationContext ctx) {
        StoreMetadata metadata = ctx.getMetadata();
        Integer count = metadata == null ? null : metadata.getProductCount();
        if (count == null) {
            return StageResult.reject(RejectionStage.ZERO_PRODUCTS, "product count unknown");
        }
        if (count <= 0) {
            return StageResult.reject(RejectionStage.ZERO_PRODUCTS, "no products");
        }
        return StageResult.pass();
    }
}
