package villagecompute.courier.integration.sms;

import villagecompute.courier.integration.GatewayResult;

/**
 * Sends one SMS to one E.164 phone number. The body is already truncated to the SMS limit.
 */
public interface SmsGateway {

    GatewayResult sendSms(String phoneNumber, String body);
}
