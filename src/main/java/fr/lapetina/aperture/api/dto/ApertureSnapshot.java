package fr.lapetina.aperture.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import fr.lapetina.aperture.domain.aperture.ApertureController;
import fr.lapetina.aperture.domain.distributor.Distributor;
import fr.lapetina.aperture.domain.model.ApertureNode;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * JSON view of the installed distributor.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApertureSnapshot(
        String label,
        String strategy,
        int logicalAperture,
        int poolSize,
        String status,
        boolean needsRebuild,
        List<NodeView> window,
        Map<String, Object> metadata,
        Instant generatedAt
) {

    public static ApertureSnapshot from(ApertureController controller) {
        // Read everything from one snapshot so the view is consistent
        Distributor distributor = controller.current();
        List<NodeView> window = distributor.window().stream()
                .map(NodeView::from)
                .toList();
        return new ApertureSnapshot(
                controller.getLabel(),
                controller.getActiveStrategy().getLabel(),
                controller.getLogicalAperture(),
                controller.getPoolSize(),
                distributor.status().name(),
                distributor.needsRebuild(),
                window,
                distributor.additionalMetadata(),
                Instant.now()
        );
    }

    public record NodeView(String address, int token, String status, int load) {
        static NodeView from(ApertureNode node) {
            return new NodeView(node.address(), node.token(), node.status().name(), node.load());
        }
    }
}
