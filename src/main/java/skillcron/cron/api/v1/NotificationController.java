package skillcron.cron.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import skillcron.cron.api.Controller;
import skillcron.cron.api.v1.dto.NotificationResponse;
import skillcron.cron.server.RouterHandler;
import skillcron.cron.service.NotificationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Notification inbox.
 *
 * GET  /api/v1/notifications              - Recent notifications (?limit=50)
 * GET  /api/v1/notifications/unread-count - Number of unread notifications
 * POST /api/v1/notifications/{id}/read    - Mark one as read
 * POST /api/v1/notifications/read-all     - Mark all as read
 */
public class NotificationController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(NotificationController.class);

    private static final String LIST_PATH = "/api/v1/notifications";
    private static final String UNREAD_PATH = "/api/v1/notifications/unread-count";
    private static final String READ_ALL_PATH = "/api/v1/notifications/read-all";
    private static final Pattern READ_PATTERN = Pattern.compile("^/api/v1/notifications/(\\d+)/read$");

    private static final int DEFAULT_LIMIT = 50;
    private static final int MAX_LIMIT = 500;

    private final NotificationService notificationService;

    public NotificationController(NotificationService notificationService) {
        this.notificationService = notificationService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.GET)) {
            return LIST_PATH.equals(path) || UNREAD_PATH.equals(path);
        }
        if (method.equals(HttpMethod.POST)) {
            return READ_ALL_PATH.equals(path) || READ_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (LIST_PATH.equals(path)) {
                int limit = RequestParams.limit(req, "limit", DEFAULT_LIMIT, MAX_LIMIT);
                List<NotificationResponse> items = notificationService.recent(limit).stream()
                        .map(NotificationResponse::from)
                        .toList();
                return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                        Map.of("notifications", items)));
            }

            if (UNREAD_PATH.equals(path)) {
                return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                        Map.of("count", notificationService.unreadCount())));
            }

            if (READ_ALL_PATH.equals(path)) {
                int updated = notificationService.markAllRead();
                return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                        Map.of("success", true, "updated", updated)));
            }

            Matcher readMatcher = READ_PATTERN.matcher(path);
            if (readMatcher.matches()) {
                long id = Long.parseLong(readMatcher.group(1));
                if (!notificationService.markRead(id)) {
                    return ControllerResponse.notFound("notification not found");
                }
                return ControllerResponse.json("{\"success\":true}");
            }

            return ControllerResponse.notFound("unknown notification endpoint");

        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Notification controller error", e);
            return ControllerResponse.error("internal error");
        }
    }
}
