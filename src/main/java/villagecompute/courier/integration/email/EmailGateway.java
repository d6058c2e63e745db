package villagecompute.courier.integration.email;

import villagecompute.courier.integration.GatewayResult;

/**
 * Sends one email to one address. No retries; the dispatcher decides what a failure means.
 */
public interface EmailGateway {

    GatewayResult sendEmail(String address, String subject, String html, String text);
}
