package com.storeradar.discovery.validation;

import com.storeradar.discovery.error.TransientProbeException;
import com.storeradar.discovery.model.RejectionStage;
import org.springframework.stereotype.Component;

/**
 * Homepage must be publicly reachable and trading.
 *
 * Password gates are checked before the "unavailable" markers: the platform's password
 * page also says "are you the store owner".
 */
@Component
public class AccessCheck implements ValidationStage {

    @Override
    public String name() {
        return "access";
    }

    @Override
    public StageResult apply(ValidationContext ctx) {
        ProbeResponse home;
        try {
            home = ctx.homepage();
        } catch (TransientProbeException e) {
            return StageResult.defer("homepage unreachable: " + e.getMessage());
        }

        int status = home.status();
        if (status == 404 || status == 410) {
            return StageResult.reject(RejectionStage.INACTIVE, "homepage HTTP " + status);
        }
        if (status == 402) {
            return StageResult.reject(RejectionStage.INACTIVE, "store frozen (HTTP 402)");
        }
        if (isPasswordGated(ctx, home)) {
            return StageResult.reject(RejectionStage.ACCESS_GATED, "password protected");
        }
        if (!home.isOk()) {
            return StageResult.reject(RejectionStage.INACTIVE, "homepage HTTP " + status);
        }
        if (StorefrontSignals.hasInactiveMarkers(home.body())) {
            return StageResult.reject(RejectionStage.INACTIVE, "store unavailable page");
        }
        return StageResult.pass();
    }

    private static boolean isPasswordGated(ValidationContext ctx, ProbeResponse home) {
        if (home.status() == 401) return true;
        if (home.finalPath().startsWith("/password")) return true;
        if (StorefrontSignals.hasPasswordMarkers(home.body())) return true;
        return !ctx.document().select("form[action*=password]").isEmpty();
    }
}
