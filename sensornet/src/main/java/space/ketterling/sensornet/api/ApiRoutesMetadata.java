package space.ketterling.sensornet.api;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.Javalin;
import io.javalin.http.Context;
import space.ketterling.sensornet.format.ResultFormatter;
import space.ketterling.sensornet.meta.MetaLevel;
import space.ketterling.sensornet.meta.MetadataResolver;
import space.ketterling.sensornet.model.MetaRecord;
import space.ketterling.sensornet.query.QueryArgs;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Metadata listings: networks, nodes (GeoJSON), sensors and features of
 * interest. Every listing goes through the metadata filter chain and is
 * cached.
 */
final class ApiRoutesMetadata {
    static final String BASE = "/v1/api/sensor-networks";

    /**
     * Utility class; do not instantiate.
     */
    private ApiRoutesMetadata() {
    }

    static void register(ApiServer api) {
        Javalin app = api.app();

        app.get(BASE, ctx -> serve(api, ctx, MetaLevel.NETWORK, null));
        app.get(BASE + "/{network}", ctx -> serve(api, ctx, MetaLevel.NETWORK, null));

        app.get(BASE + "/{network}/nodes", ctx -> serve(api, ctx, MetaLevel.NODES, null));
        app.get(BASE + "/{network}/nodes/{node}", ctx -> serve(api, ctx, MetaLevel.NODES, "node"));

        app.get(BASE + "/{network}/sensors", ctx -> serve(api, ctx, MetaLevel.SENSORS, null));
        app.get(BASE + "/{network}/sensors/{sensor}", ctx -> serve(api, ctx, MetaLevel.SENSORS, "sensor"));

        app.get(BASE + "/{network}/features_of_interest", ctx -> serve(api, ctx, MetaLevel.FEATURES, null));
        app.get(BASE + "/{network}/features_of_interest/{feature}",
                ctx -> serve(api, ctx, MetaLevel.FEATURES, "feature"));
    }

    /**
     * Serves records at {@code level}. A single-record path parameter
     * replaces the list filter of that level.
     */
    private static void serve(ApiServer api, Context ctx, MetaLevel level, String pathParam) throws Exception {
        String cacheKey = ApiServer.cacheKey(ctx);
        if (api.serveCached(ctx, cacheKey)) {
            return;
        }

        Map<String, String> params = api.params(ctx);
        if (pathParam != null)
            params.put(level.label(), params.remove(pathParam));

        QueryArgs args = api.validator().metadata(params);
        MetadataResolver resolver = api.resolver();
        ResultFormatter formatter = api.formatter();

        List<? extends MetaRecord> records = resolver.resolve(level, args.metadataFilter());
        List<ObjectNode> data = new ArrayList<>();
        for (MetaRecord record : records)
            data.add(formatter.format(record));

        api.cacheAndRespond(ctx, cacheKey, formatter.envelope(args.echo(), data));
    }
}
