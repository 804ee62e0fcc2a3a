package com.storeradar.discovery.validation;

import com.storeradar.discovery.error.TransientProbeException;
import com.storeradar.discovery.model.RejectionStage;
import com.storeradar.discovery.normalize.UrlNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Is this a storefront on the platform at all?
 *
 * Signals, first positive wins:
 *  1. homepage carries an X-ShopId header or platform CDN assets
 *  2. /cart.js answers with a cart JSON object
 *  3. /products.json answers with a products array
 *  4. the host is a myshopify.com subdomain
 *
 * If every network probe failed transiently and nothing was positive the candidate is
 * deferred; otherwise a negative is final.
 */
@Component
@Slf4j
public class PlatformMembershipCheck implements ValidationStage {

    private static final int NETWORK_PROBES = 3;

    @Override
    public String name() {
        return "platform";
    }

    @Override
    public StageResult apply(ValidationContext ctx) {
        int transientFailures = 0;
        String lastError = null;

        try {
            ProbeResponse home = ctx.homepage();
            if (StorefrontSignals.hasShopHeader(home) || StorefrontSignals.hasPlatformAssets(home.body())) {
                return StageResult.pass();
            }
        } catch (TransientProbeException e) {
            transientFailures++;
            lastError = e.getMessage();
        }

        try {
            ProbeResponse cart = ctx.probe("/cart.js");
            if (cart.isOk() && ctx.parseJson(cart.body())
                    .filter(json -> json.has("token") || json.has("items"))
                    .isPresent()) {
                return StageResult.pass();
            }
        } catch (TransientProbeException e) {
            transientFailures++;
            lastError = e.getMessage();
        }

        try {
            if (ctx.productsPage(1).isPresent()) {
                return StageResult.pass();
            }
        } catch (TransientProbeException e) {
            transientFailures++;
            lastError = e.getMessage();
        }

        if (UrlNormalizer.isPlatformHost(ctx.identityUrl())) {
            log.debug("{} passed on host name alone", ctx.identityUrl());
            return StageResult.pass();
        }

        if (transientFailures == NETWORK_PROBES) {
            return StageResult.defer("platform probes unreachable: " + lastError);
        }
        return StageResult.reject(RejectionStage.PLATFORM, "no platform fingerprint");
    }
}
