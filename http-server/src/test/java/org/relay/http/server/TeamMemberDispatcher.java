package org.relay.http.server;

import org.relay.http.Captures;
import org.relay.http.DispatchOutcome;
import org.relay.http.Dispatcher;
import org.relay.http.Extensions;
import org.relay.http.Handler;
import org.relay.http.HttpMethod;
import org.relay.http.Request;
import org.relay.http.Response;
import org.relay.http.extract.PathExtractor;
import org.relay.http.extract.PathShape;
import org.relay.http.extract.Scalars;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Stands in for the router: matches {@code GET /users/{user_id}/teams/{team_id}} and
 * {@code GET /crash}, binding captures the way a router would.
 */
final class TeamMemberDispatcher implements Dispatcher {
    private static final PathExtractor<Map.Entry<Integer, Integer>> MEMBER =
            PathExtractor.path(PathShape.pair(Scalars.INTEGER, Scalars.INTEGER));

    final List<Map.Entry<Integer, Integer>> observed = new CopyOnWriteArrayList<>();

    private final Handler memberHandler = Handler.extracting(MEMBER, (request, ids) -> {
        observed.add(ids);
        return Response.ok("user " + ids.getKey() + " in team " + ids.getValue());
    });

    @Override
    public DispatchOutcome dispatch(Request request, Extensions extensions) {
        var segments = request.path().split("/");

        if (request.method() == HttpMethod.GET && request.path().equals("/crash")) {
            throw new IllegalStateException("handler crashed");
        }
        if (request.method() == HttpMethod.GET && segments.length == 5
            && segments[1].equals("users") && segments[3].equals("teams")) {
            extensions.require(Captures.class)
                      .merge(Captures.of("user_id", segments[2], "team_id", segments[4]));
            return memberHandler.invoke(request, extensions);
        }
        return DispatchOutcome.noRouteMatched(request);
    }
}
