package space.ketterling.sensornet.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.Javalin;
import space.ketterling.sensornet.aggregate.AggregateValue;
import space.ketterling.sensornet.export.ExportJobQueue;
import space.ketterling.sensornet.format.ResultFormatter;
import space.ketterling.sensornet.query.ObservationService;
import space.ketterling.sensornet.query.QueryArgs;

import java.util.ArrayList;
import java.util.List;

/**
 * Raw observations, per-node aggregates and datadump requests.
 */
final class ApiRoutesObservations {
    /**
     * Utility class; do not instantiate.
     */
    private ApiRoutesObservations() {
    }

    static void register(ApiServer api) {
        Javalin app = api.app();
        ObjectMapper om = api.om();
        ObservationService observations = api.observations();
        ResultFormatter formatter = api.formatter();
        ExportJobQueue exports = api.exports();
        String base = ApiRoutesMetadata.BASE;

        // Not cached: the default window moves with the clock
        app.get(base + "/{network}/query", ctx -> {
            QueryArgs args = api.validator().query(api.params(ctx));
            List<ObjectNode> data = observations.observations(args);
            api.respond(ctx, formatter.envelope(args.echo(), data));
        });

        app.get(base + "/{network}/aggregate", ctx -> {
            String cacheKey = ApiServer.cacheKey(ctx);
            if (api.serveCached(ctx, cacheKey)) {
                return;
            }

            QueryArgs args = api.validator().aggregate(api.params(ctx));
            List<ObjectNode> data = new ArrayList<>();
            for (AggregateValue value : observations.aggregate(args))
                data.add(formatter.formatAggregate(value));

            api.cacheAndRespond(ctx, cacheKey, formatter.envelope(args.echo(), data));
        });

        app.get(base + "/{network}/download", ctx -> {
            QueryArgs args = api.validator().download(api.params(ctx));
            String urlRoot = api.cfg().datadumpUrlRoot();
            String ticket = exports.submit(args, urlRoot);

            ObjectNode out = om.createObjectNode()
                    .put("ticket", ticket)
                    .put("status", "queued")
                    .put("url", ApiRoutesJobs.statusUrl(urlRoot, ticket));
            out.set("request", om.valueToTree(args.echo()));
            ctx.status(202);
            api.respond(ctx, out);
        });
    }
}
