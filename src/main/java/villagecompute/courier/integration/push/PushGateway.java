package villagecompute.courier.integration.push;

import villagecompute.courier.integration.GatewayResult;

import java.util.Map;

/**
 * Sends one push notification to one device token. No retries; the dispatcher decides what a failure means.
 */
public interface PushGateway {

    GatewayResult sendPush(String deviceToken, String title, String body, Map<String, String> data);
}
