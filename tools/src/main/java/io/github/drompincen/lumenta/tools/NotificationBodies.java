package io.github.drompincen.lumenta.tools;

import org.springframework.web.util.HtmlUtils;

final class NotificationBodies {

    private NotificationBodies() {}

    /** {@code severity} may be null, in which case the block is styled medium and no severity line is shown. */
    static String html(String title, String message, String severity) {
        String heading = HtmlUtils.htmlEscape(title.isBlank() ? "Notification" : title);
        String body = HtmlUtils.htmlEscape(message).replace("\n", "<br>");
        String severityLine = severity != null
                ? "<p><strong>Severity:</strong> " + HtmlUtils.htmlEscape(severity) + "</p>"
                : "";
        return """
                <!DOCTYPE html>
                <html>
                  <head>
                    <meta charset="utf-8">
                    <style>
                      body { font-family: Arial, sans-serif; line-height: 1.6; color: #333; }
                      .container { max-width: 600px; margin: 0 auto; padding: 20px; }
                      .severity-high { border-left: 4px solid #ef4444; padding-left: 15px; }
                      .severity-medium { border-left: 4px solid #f59e0b; padding-left: 15px; }
                      .severity-low { border-left: 4px solid #3b82f6; padding-left: 15px; }
                      .message { background: #f9fafb; padding: 15px; border-radius: 5px; margin: 15px 0; }
                    </style>
                  </head>
                  <body>
                    <div class="container">
                      <h1>%s</h1>
                      <div class="message severity-%s">
                        <p>%s</p>
                      </div>
                      %s
                      <hr>
                      <p style="color: #666; font-size: 12px;">This notification was sent from Lumenta Platform.</p>
                    </div>
                  </body>
                </html>
                """.formatted(heading, severity != null ? HtmlUtils.htmlEscape(severity) : "medium", body, severityLine);
    }

    static String text(String title, String message, String severity) {
        return (title.isBlank() ? "Notification" : title) + "\n\n" + message
                + "\n\nSeverity: " + (severity != null ? severity : "medium")
                + "\n\nThis notification was sent from Lumenta Platform.";
    }
}
