package space.ketterling.sensornet.api;

import io.javalin.Javalin;
import space.ketterling.sensornet.export.JobStatus;
import space.ketterling.sensornet.export.JobStatusStore;

/**
 * Status polling for datadump tickets.
 */
final class ApiRoutesJobs {
    /**
     * Utility class; do not instantiate.
     */
    private ApiRoutesJobs() {
    }

    static String statusUrl(String urlRoot, String ticket) {
        String root = urlRoot == null ? "" : urlRoot;
        if (!root.isEmpty() && !root.endsWith("/"))
            root = root + "/";
        return root + "v1/api/jobs/" + ticket;
    }

    static void register(ApiServer api) {
        Javalin app = api.app();
        JobStatusStore jobs = api.jobs();

        app.get("/v1/api/jobs/{ticket}", ctx -> {
            String ticket = ctx.pathParam("ticket");
            JobStatus status = jobs.getStatus(ticket);
            if (status == null) {
                ctx.status(404).json(api.om().createObjectNode()
                        .put("error", "not_found")
                        .put("message", "Unknown ticket: " + ticket));
                return;
            }
            api.respond(ctx, api.om().valueToTree(status));
        });
    }
}
