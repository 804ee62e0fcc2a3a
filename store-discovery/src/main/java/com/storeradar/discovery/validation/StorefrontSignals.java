package com.storeradar.discovery.validation;

import java.util.List;
import java.util.Locale;

/**
 * Text and header markers that identify a platform storefront and its state.
 */
public final class StorefrontSignals {

    private static final List<String> ASSET_MARKERS = List.of(
            "cdn.shopify.com", "shopify.theme", "shopify-digital-wallet", "myshopify.com/cdn");

    private static final List<String> PASSWORD_MARKERS = List.of(
            "enter store password", "enter using password", "this store is password protected",
            "password-protected");

    private static final List<String> INACTIVE_MARKERS = List.of(
            "sorry, this store is currently unavailable",
            "this store is currently unavailable",
            "are you the store owner",
            "reactivate your store",
            "open a new shopify store",
            "explore other stores",
            "this shop is unavailable");

    private StorefrontSignals() {
    }

    public static boolean hasShopHeader(ProbeResponse response) {
        return response.header("X-ShopId").isPresent() || response.header("X-Shopify-Stage").isPresent();
    }

    public static boolean hasPlatformAssets(String body) {
        return containsAny(body, ASSET_MARKERS);
    }

    public static boolean hasPasswordMarkers(String body) {
        return containsAny(body, PASSWORD_MARKERS);
    }

    public static boolean hasInactiveMarkers(String body) {
        return containsAny(body, INACTIVE_MARKERS);
    }

    private static boolean containsAny(String body, List<String> markers) {
        if (body == null || body.isEmpty()) return false;
        String lower = body.toLowerCase(Locale.ROOT);
        return markers.stream().anyMatch(lower::contains);
    }
}
