package io.github.drompincen.lumenta.runtime.action;

final class ActionPrompts {

    private ActionPrompts() {}

    static String parsing(ActionOption option, String description) {
        String type = option.wire();
        StringBuilder prompt = new StringBuilder()
                .append("You are parsing a natural language action description for a ").append(type).append(" action.\n\n")
                .append("Action Type: ").append(type).append('\n')
                .append("Description: \"").append(description).append("\"\n\n")
                .append("Extract the following parameters based on the action type:\n\n");

        switch (option) {
            case CALL -> prompt.append("""
                    For a phone call action, extract:
                    - to: Phone number to call (must include country code, e.g., +1234567890). Extract from the description.
                    - message: Optional message or script for the call. If not mentioned, leave empty.

                    Examples:
                    - "Call John at +1-555-123-4567" → {"to": "+15551234567"}
                    - "Call the security team at 408-306-6734 and tell them about the incident" → {"to": "+14083066734", "message": "Tell them about the incident"}
                    - "Phone call to +1234567890" → {"to": "+1234567890"}
                    """);
            case EMAIL -> prompt.append("""
                    For an email action, extract:
                    - recipientEmail: Email address of the recipient. Extract from the description.
                    - title: Subject line for the email. If not mentioned, create a relevant title based on the description.
                    - message: Email body content. Use the description as the message if it's not just an email address.

                    Examples:
                    - "Send email to john@example.com" → {"recipientEmail": "john@example.com", "title": "Notification", "message": "Notification from Lumenta"}
                    - "Email boss@company.com about the incident" → {"recipientEmail": "boss@company.com", "title": "Incident Report", "message": "about the incident"}
                    """);
            case TEXT -> prompt.append("""
                    For a text message (SMS) action, extract:
                    - recipientPhone: Phone number to send SMS to (must include country code, e.g., +1234567890). Extract from the description.
                    - message: The text message content. Use the description as the message if it's not just a phone number.

                    Examples:
                    - "Text +1-555-123-4567" → {"recipientPhone": "+15551234567", "message": "Notification from Lumenta"}
                    - "Send SMS to 408-306-6734 saying alert triggered" → {"recipientPhone": "+14083066734", "message": "alert triggered"}
                    """);
        }

        prompt.append("""

                Return ONLY a JSON object with this structure:
                {
                  "parameters": {
                    // extracted parameters based on action type
                  }
                }

                If you cannot extract a required parameter, leave it empty.""");
        return prompt.toString();
    }
}
