package com.travelcrm.global.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "travelcrm.midtrans")
public class MidtransProperties {

    private static final String SNAP_SANDBOX_URL = "https://app.sandbox.midtrans.com";
    private static final String SNAP_PRODUCTION_URL = "https://app.midtrans.com";
    private static final String API_SANDBOX_URL = "https://api.sandbox.midtrans.com";
    private static final String API_PRODUCTION_URL = "https://api.midtrans.com";

    private String serverKey;
    private String clientKey;
    private boolean production = false;

    // Snap callbacks (finish/error/pending) 기준 URL
    private String frontendUrl = "http://localhost:3001";

    // 결제 유효 시간 (시간)
    private int expiryHours = 24;

    private Reconcile reconcile = new Reconcile();

    public String getSnapBaseUrl() {
        return production ? SNAP_PRODUCTION_URL : SNAP_SANDBOX_URL;
    }

    public String getApiBaseUrl() {
        return production ? API_PRODUCTION_URL : API_SANDBOX_URL;
    }

    @Getter
    @Setter
    public static class Reconcile {
        private boolean enabled = true;
        private long intervalMinutes = 5;
        private long staleAfterMinutes = 15;
    }
}
