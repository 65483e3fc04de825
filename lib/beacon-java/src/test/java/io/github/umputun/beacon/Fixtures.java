package io.github.umputun.beacon;

/**
 * Subscribe response bodies in the service wire format.
 */
final class Fixtures {

    private Fixtures() {
    }

    static String response(String timetoken, int region, String... envelopes) {
        return "{\"t\":{\"t\":\"" + timetoken + "\",\"r\":" + region + "},\"m\":[" + String.join(",", envelopes) + "]}";
    }

    static String handshake(String timetoken) {
        return response(timetoken, 1);
    }

    static String message(String channel, String payloadJson, String timetoken) {
        return "{\"a\":\"1\",\"f\":0,\"i\":\"publisher-1\",\"p\":{\"t\":\"" + timetoken + "\",\"r\":1},"
                + "\"k\":\"demo\",\"c\":\"" + channel + "\",\"d\":" + payloadJson + "}";
    }

    static String typed(int type, String channel, String payloadJson, String timetoken) {
        return "{\"a\":\"1\",\"f\":0,\"e\":" + type + ",\"i\":\"publisher-1\",\"p\":{\"t\":\"" + timetoken
                + "\",\"r\":1},\"k\":\"demo\",\"c\":\"" + channel + "\",\"d\":" + payloadJson + "}";
    }

    static String presence(String channel, String payloadJson, String timetoken) {
        return message(channel + "-pnpres", payloadJson, timetoken);
    }
}
