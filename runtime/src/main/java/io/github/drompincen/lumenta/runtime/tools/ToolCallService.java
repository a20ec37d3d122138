package io.github.drompincen.lumenta.runtime.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.lumenta.protocol.integration.Integration;
import io.github.drompincen.lumenta.runtime.integration.IntegrationRouter;
import io.github.drompincen.lumenta.runtime.integration.IntegrationStore;
import io.github.drompincen.lumenta.runtime.integration.RoutedCall;
import io.github.drompincen.lumenta.runtime.provider.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Single entry point for tool invocations, whatever their origin.
 *
 * <ol>
 *   <li>resolve the tool ({@link UnknownToolException});</li>
 *   <li>validate arguments against its schema ({@link InvalidToolArgumentsException});</li>
 *   <li>if an active integration is bound to the tool, run the routed call, falling back to the
 *       tool itself when routing or the routed execution throws;</li>
 *   <li>run the tool; failures become {@code isError} results.</li>
 * </ol>
 */
@Service
public class ToolCallService {

    private static final Logger log = LoggerFactory.getLogger(ToolCallService.class);

    private final ToolRegistry toolRegistry;
    private final ToolSchemaValidator validator;
    private final IntegrationStore integrationStore;
    private final IntegrationRouter integrationRouter;

    public ToolCallService(ToolRegistry toolRegistry, ToolSchemaValidator validator,
                           IntegrationStore integrationStore, IntegrationRouter integrationRouter) {
        this.toolRegistry = toolRegistry;
        this.validator = validator;
        this.integrationStore = integrationStore;
        this.integrationRouter = integrationRouter;
    }

    public ToolResult call(String name, JsonNode arguments, ToolCallOrigin origin) {
        Tool tool = toolRegistry.get(name).orElseThrow(() -> new UnknownToolException(name));
        ObjectNode args = validator.validate(tool, arguments);
        String callId = UUID.randomUUID().toString();
        log.debug("Tool call {} -> {} (origin {})", callId, name, origin.wire());

        List<Integration> bound = integrationStore.activeFor(name);
        if (!bound.isEmpty()) {
            Integration integration = bound.get(0);
            try {
                return callRouted(integration, args, callId);
            } catch (RuntimeException e) {
                log.warn("Integration {} failed for tool {}, using default implementation: {}",
                        integration.id(), name, e.getMessage());
            }
        }
        return execute(tool, ToolContext.of(callId, origin), args);
    }

    private ToolResult callRouted(Integration integration, ObjectNode args, String callId) {
        RoutedCall routed = integrationRouter.route(integration, args);
        Tool target = toolRegistry.get(routed.toolName())
                .orElseThrow(() -> new UnknownToolException(routed.toolName()));
        ObjectNode routedArgs = validator.validate(target, routed.arguments());
        log.info("Routing {} through integration {} as {}", integration.toolName(), integration.id(), target.name());
        ToolResult result = target.execute(
                new ToolContext(callId, ToolCallOrigin.INTEGRATION, integration.id()), routedArgs);
        if (result == null) {
            throw new IllegalStateException("Tool " + target.name() + " returned no result");
        }
        return result;
    }

    private ToolResult execute(Tool tool, ToolContext ctx, ObjectNode args) {
        try {
            ToolResult result = tool.execute(ctx, args);
            return result != null ? result : ToolResult.failure("Tool " + tool.name() + " returned no result");
        } catch (ProviderException e) {
            log.warn("Provider {} rejected {} call {}: {}", e.provider(), tool.name(), ctx.callId(), e.getMessage());
            return ToolResult.failure(e.getMessage());
        } catch (RuntimeException e) {
            log.error("Tool {} failed on call {}", tool.name(), ctx.callId(), e);
            return ToolResult.failure(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }
}
