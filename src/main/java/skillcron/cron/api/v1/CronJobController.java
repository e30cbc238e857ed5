package skillcron.cron.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import skillcron.cron.api.Controller;
import skillcron.cron.api.v1.dto.CreateJobRequest;
import skillcron.cron.api.v1.dto.JobResponse;
import skillcron.cron.api.v1.dto.RunResponse;
import skillcron.cron.api.v1.dto.TriggerResponse;
import skillcron.cron.api.v1.dto.UpdateJobRequest;
import skillcron.cron.model.Job;
import skillcron.cron.model.TriggerResult;
import skillcron.cron.server.RouterHandler;
import skillcron.cron.service.JobService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for scheduled job management.
 *
 * GET    /api/v1/cron/jobs             - List jobs (?sourceChannel=&sourceId=)
 * POST   /api/v1/cron/jobs             - Create a job
 * GET    /api/v1/cron/jobs/{id}        - Get a job
 * PATCH  /api/v1/cron/jobs/{id}        - Update a job
 * DELETE /api/v1/cron/jobs/{id}        - Delete a job
 * POST   /api/v1/cron/jobs/{id}/run    - Run a job now
 * GET    /api/v1/cron/jobs/{id}/runs   - Run history (?limit=20)
 */
public class CronJobController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(CronJobController.class);

    private static final Pattern JOBS_PATTERN = Pattern.compile("^/api/v1/cron/jobs$");
    private static final Pattern JOB_BY_ID_PATTERN = Pattern.compile("^/api/v1/cron/jobs/([^/]+)$");
    private static final Pattern JOB_RUN_PATTERN = Pattern.compile("^/api/v1/cron/jobs/([^/]+)/run$");
    private static final Pattern JOB_RUNS_PATTERN = Pattern.compile("^/api/v1/cron/jobs/([^/]+)/runs$");

    private static final int DEFAULT_RUNS_LIMIT = 20;
    private static final int MAX_RUNS_LIMIT = 500;

    private final JobService jobService;

    public CronJobController(JobService jobService) {
        this.jobService = jobService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (JOBS_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.GET) || method.equals(HttpMethod.POST);
        }
        if (JOB_BY_ID_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.GET) || method.equals(HttpMethod.PATCH)
                    || method.equals(HttpMethod.DELETE);
        }
        if (JOB_RUN_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.POST);
        }
        return method.equals(HttpMethod.GET) && JOB_RUNS_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            HttpMethod method = req.method();

            if (JOBS_PATTERN.matcher(path).matches()) {
                return method.equals(HttpMethod.POST) ? handleCreate(req) : handleList(req);
            }

            Matcher runMatcher = JOB_RUN_PATTERN.matcher(path);
            if (runMatcher.matches()) {
                return handleRun(runMatcher.group(1));
            }

            Matcher runsMatcher = JOB_RUNS_PATTERN.matcher(path);
            if (runsMatcher.matches()) {
                return handleRuns(req, runsMatcher.group(1));
            }

            Matcher jobMatcher = JOB_BY_ID_PATTERN.matcher(path);
            if (jobMatcher.matches()) {
                String jobId = jobMatcher.group(1);
                if (method.equals(HttpMethod.PATCH))
                    return handleUpdate(req, jobId);
                if (method.equals(HttpMethod.DELETE))
                    return handleDelete(jobId);
                return handleGet(jobId);
            }

            return ControllerResponse.notFound("unknown cron endpoint");

        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("invalid JSON: " + e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Cron job controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    /**
     * GET /api/v1/cron/jobs
     */
    private ControllerResponse handleList(FullHttpRequest req) throws Exception {
        String channel = RequestParams.string(req, "sourceChannel");
        String sourceId = RequestParams.string(req, "sourceId");

        List<Job> jobs = (channel != null && sourceId != null)
                ? jobService.findBySource(channel, sourceId)
                : jobService.findAll();

        List<JobResponse> body = jobs.stream().map(this::toResponse).toList();
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                Map.of("jobs", body, "total", body.size())));
    }

    /**
     * POST /api/v1/cron/jobs
     */
    private ControllerResponse handleCreate(FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        CreateJobRequest request = RouterHandler.mapper().readValue(body, CreateJobRequest.class);
        if (request == null) {
            throw new IllegalArgumentException("request body is required");
        }

        request.validate();
        Job job = jobService.create(request.toNewJob());

        return ControllerResponse.json(
                HttpResponseStatus.CREATED,
                RouterHandler.mapper().writeValueAsString(toResponse(job)));
    }

    /**
     * GET /api/v1/cron/jobs/{id}
     */
    private ControllerResponse handleGet(String jobId) throws Exception {
        Optional<Job> job = jobService.findById(jobId);
        if (job.isEmpty()) {
            return ControllerResponse.notFound("job not found");
        }
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(toResponse(job.get())));
    }

    /**
     * PATCH /api/v1/cron/jobs/{id}
     */
    private ControllerResponse handleUpdate(FullHttpRequest req, String jobId) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        UpdateJobRequest request = RouterHandler.mapper().readValue(body, UpdateJobRequest.class);
        if (request == null) {
            throw new IllegalArgumentException("request body is required");
        }

        Optional<Job> updated = jobService.update(jobId, request.toPatch());
        if (updated.isEmpty()) {
            return ControllerResponse.notFound("job not found");
        }
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(toResponse(updated.get())));
    }

    /**
     * DELETE /api/v1/cron/jobs/{id}
     */
    private ControllerResponse handleDelete(String jobId) {
        if (!jobService.delete(jobId)) {
            return ControllerResponse.notFound("job not found");
        }
        return ControllerResponse.json("{\"success\":true}");
    }

    /**
     * POST /api/v1/cron/jobs/{id}/run
     *
     * Blocks until the run finishes.
     */
    private ControllerResponse handleRun(String jobId) throws Exception {
        TriggerResult result = jobService.trigger(jobId);
        String body = RouterHandler.mapper().writeValueAsString(TriggerResponse.from(result));

        return switch (result.outcome()) {
            case COMPLETED -> ControllerResponse.json(body);
            case NOT_FOUND -> ControllerResponse.json(HttpResponseStatus.NOT_FOUND, body);
            case FAILED -> ControllerResponse.json(HttpResponseStatus.INTERNAL_SERVER_ERROR, body);
        };
    }

    /**
     * GET /api/v1/cron/jobs/{id}/runs
     */
    private ControllerResponse handleRuns(FullHttpRequest req, String jobId) throws Exception {
        if (jobService.findById(jobId).isEmpty()) {
            return ControllerResponse.notFound("job not found");
        }
        int limit = RequestParams.limit(req, "limit", DEFAULT_RUNS_LIMIT, MAX_RUNS_LIMIT);

        List<RunResponse> runs = jobService.runs(jobId, limit).stream()
                .map(RunResponse::from)
                .toList();

        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                Map.of("jobId", jobId, "runs", runs)));
    }

    private JobResponse toResponse(Job job) {
        return JobResponse.from(job, jobService.describe(job.schedule()));
    }
}
