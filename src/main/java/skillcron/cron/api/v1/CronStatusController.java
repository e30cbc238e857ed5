package skillcron.cron.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import skillcron.cron.api.Controller;
import skillcron.cron.api.v1.dto.ScheduleDto;
import skillcron.cron.api.v1.dto.StatusResponse;
import skillcron.cron.model.Schedule;
import skillcron.cron.server.RouterHandler;
import skillcron.cron.service.JobService;
import skillcron.cron.service.JobValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * GET  /api/v1/cron/status   - Poller status
 * POST /api/v1/cron/describe - Human-readable description of a schedule
 */
public class CronStatusController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(CronStatusController.class);

    private static final String STATUS_PATH = "/api/v1/cron/status";
    private static final String DESCRIBE_PATH = "/api/v1/cron/describe";

    private final JobService jobService;

    public CronStatusController(JobService jobService) {
        this.jobService = jobService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return (method.equals(HttpMethod.GET) && STATUS_PATH.equals(path))
                || (method.equals(HttpMethod.POST) && DESCRIBE_PATH.equals(path));
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (STATUS_PATH.equals(path)) {
                StatusResponse status = StatusResponse.from(jobService.status());
                return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(status));
            }

            String body = req.content().toString(StandardCharsets.UTF_8);
            ScheduleDto dto = RouterHandler.mapper().readValue(body, ScheduleDto.class);
            if (dto == null) {
                throw new IllegalArgumentException("schedule is required");
            }
            Schedule schedule = dto.toSchedule();
            JobValidator.validateSchedule(schedule);

            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                    Map.of("description", jobService.describe(schedule))));

        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("invalid JSON: " + e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Cron status controller error", e);
            return ControllerResponse.error("internal error");
        }
    }
}
