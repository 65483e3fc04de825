package io.github.umputun.beacon;

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import io.github.umputun.beacon.transport.TransportRequest;
import io.github.umputun.beacon.transport.TransportRequest.Operation;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds subscribe, heartbeat and leave requests for one configuration. Stateless.
 */
final class Endpoints {

    private static final String EMPTY_CHANNELS = ",";

    private final ClientOptions options;
    private final Gson gson;

    Endpoints(ClientOptions options) {
        this.options = options;
        this.gson = new Gson();
    }

    TransportRequest subscribe(SubscriptionSet.Snapshot snapshot, Cursor cursor) {
        String path = "/v2/subscribe/" + encodePath(options.getSubscribeKey())
                + "/" + channelSegment(snapshot.allChannels()) + "/0";

        Map<String, String> query = baseQuery();
        putGroups(query, snapshot.allGroups());
        query.put("tt", cursor.timetokenString());
        if (!cursor.isStart()) {
            query.put("tr", String.valueOf(cursor.getRegion()));
        }
        if (options.getFilterExpression() != null) {
            query.put("filter-expr", options.getFilterExpression());
        }
        query.put("heartbeat", String.valueOf(options.getPresenceTimeout().getSeconds()));
        if (options.isMaintainPresenceState()) {
            putState(query, snapshot.state());
        }
        putAuth(query);
        return new TransportRequest(Operation.SUBSCRIBE, path, query, options.getSubscribeTimeout());
    }

    TransportRequest heartbeat(SubscriptionSet.Snapshot snapshot) {
        String path = "/v2/presence/sub-key/" + encodePath(options.getSubscribeKey())
                + "/channel/" + channelSegment(snapshot.channels()) + "/heartbeat";

        Map<String, String> query = baseQuery();
        query.put("heartbeat", String.valueOf(options.getPresenceTimeout().getSeconds()));
        putGroups(query, snapshot.groups());
        putState(query, snapshot.state());
        putAuth(query);
        return new TransportRequest(Operation.HEARTBEAT, path, query, options.getTimeout());
    }

    TransportRequest leave(List<String> channels, List<String> groups) {
        String path = "/v2/presence/sub_key/" + encodePath(options.getSubscribeKey())
                + "/channel/" + channelSegment(channels) + "/leave";

        Map<String, String> query = baseQuery();
        putGroups(query, groups);
        putAuth(query);
        return new TransportRequest(Operation.LEAVE, path, query, options.getTimeout());
    }

    private Map<String, String> baseQuery() {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("uuid", options.getUserId());
        return query;
    }

    private static void putGroups(Map<String, String> query, List<String> groups) {
        if (!groups.isEmpty()) {
            query.put("channel-group", String.join(",", groups));
        }
    }

    private void putState(Map<String, String> query, JsonObject state) {
        if (state.size() > 0) {
            query.put("state", gson.toJson(state));
        }
    }

    private void putAuth(Map<String, String> query) {
        if (options.getAuthKey() != null) {
            query.put("auth", options.getAuthKey());
        }
    }

    // commas separate names and stay unencoded
    private static String channelSegment(List<String> names) {
        if (names.isEmpty()) {
            return EMPTY_CHANNELS;
        }
        StringBuilder sb = new StringBuilder();
        for (String name : names) {
            if (sb.length() > 0) {
                sb.append(',');
            }
            sb.append(encodePath(name));
        }
        return sb.toString();
    }

    private static String encodePath(String segment) {
        return TransportRequest.encode(segment);
    }
}
