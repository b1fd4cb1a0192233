package idforecast;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import idforecast.config.ConfigLoader;
import idforecast.config.ModelConfig;
import idforecast.config.RunConfig;
import idforecast.data.ObservationCsvReader;
import idforecast.data.ObservationTable;
import idforecast.hub.HubRow;
import idforecast.model.ForecastModels;
import idforecast.model.ForecastResult;
import io.javalin.Javalin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP surface for forecast runs.
 * <p>
 * {@code POST /api/forecast} with {@code {"model": {...}, "run": {...}, "features": "<csv>"}} answers the hub
 * rows as JSON. Nothing is written to disk.
 * Run with: mvn exec:java -Dexec.mainClass="idforecast.WebApp"
 */
public class WebApp {

    private static final Logger log = LoggerFactory.getLogger(WebApp.class);
    private static final Gson GSON = new Gson();

    private static int getPort() {
        String env = System.getenv("PORT");
        if (env != null && !env.isBlank()) {
            try {
                return Integer.parseInt(env.trim());
            } catch (NumberFormatException e) {
                log.warn("Ignoring non-numeric PORT '{}'", env);
            }
        }
        return 7000;
    }

    public static void main(String[] args) {
        int port = getPort();
        Javalin app = Javalin.create().start("0.0.0.0", port);

        app.post("/api/forecast", ctx -> {
            Response response = forecast(ctx.body());
            ctx.status(response.status).contentType("application/json").result(GSON.toJson(response.body));
        });

        app.get("/api/health", ctx -> {
            Map<String, Object> h = new LinkedHashMap<>();
            h.put("status", "ok");
            h.put("port", port);
            ctx.contentType("application/json").result(GSON.toJson(h));
        });

        log.info("Forecast web app listening on http://localhost:{}", port);
    }

    static final class Response {
        final int status;
        final Map<String, Object> body;

        Response(int status, Map<String, Object> body) {
            this.status = status;
            this.body = body;
        }
    }

    /** Run a forecast for one request body. Configuration and data errors answer 400. */
    static Response forecast(String body) {
        Map<String, Object> out = new LinkedHashMap<>();
        try {
            if (body == null || body.isBlank()) throw new IllegalArgumentException("Missing request body");
            JsonObject req = ConfigLoader.parseObject(body);
            JsonObject model = object(req, "model");
            JsonObject run = object(req, "run");
            if (!run.has("output_root")) run.addProperty("output_root", System.getProperty("java.io.tmpdir"));
            JsonElement features = req.get("features");
            if (features == null || !features.isJsonPrimitive()) {
                throw new IllegalArgumentException("Missing 'features' CSV text");
            }

            ModelConfig modelConfig = ConfigLoader.modelConfig(model);
            RunConfig runConfig = ConfigLoader.runConfig(run);
            ObservationTable table = ObservationCsvReader.read(new StringReader(features.getAsString()));
            ForecastResult result = ForecastModels.create(modelConfig).forecast(runConfig, table);

            List<Map<String, Object>> rows = new ArrayList<>(result.getHubRows().size());
            for (HubRow r : result.getHubRows()) rows.add(toJson(r));
            out.put("count", rows.size());
            out.put("rows", rows);
            return new Response(200, out);
        } catch (IllegalArgumentException | IllegalStateException e) {
            out.put("error", e.getMessage());
            return new Response(400, out);
        } catch (IOException | UncheckedIOException e) {
            out.put("error", "Could not read features: " + e.getMessage());
            return new Response(400, out);
        } catch (RuntimeException e) {
            log.error("Forecast request failed", e);
            String msg = e.getMessage();
            out.put("error", msg != null && !msg.isEmpty() ? msg : e.getClass().getSimpleName());
            return new Response(500, out);
        }
    }

    private static JsonObject object(JsonObject req, String key) {
        JsonElement el = req.get(key);
        if (el == null || !el.isJsonObject()) throw new IllegalArgumentException("Missing or invalid '" + key + "' object");
        return el.getAsJsonObject();
    }

    private static Map<String, Object> toJson(HubRow r) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("location", r.getLocation());
        m.put("reference_date", r.getReferenceDate().toString());
        m.put("horizon", r.getHorizon());
        m.put("target_end_date", r.getTargetEndDate().toString());
        m.put("target", r.getTarget());
        m.put("output_type", r.getOutputType());
        m.put("output_type_id", r.getOutputTypeId());
        m.put("value", r.getValue());
        return m;
    }
}
