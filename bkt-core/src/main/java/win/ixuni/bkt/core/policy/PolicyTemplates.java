package win.ixuni.bkt.core.policy;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 内置策略模板
 */
public final class PolicyTemplates {

    private PolicyTemplates() {
    }

    public static PolicyDocument denyAll() {
        return PolicyDocument.builder()
                .version(PolicyDocument.VERSION)
                .statements(List.of(Statement.builder()
                        .sid("DenyAll")
                        .effect(Effect.DENY.getValue())
                        .actions(List.of("*"))
                        .resources(List.of("*"))
                        .build()))
                .build();
    }

    public static PolicyDocument readOnly() {
        return PolicyDocument.builder()
                .version(PolicyDocument.VERSION)
                .statements(List.of(Statement.builder()
                        .sid("ReadOnlyAccess")
                        .effect(Effect.ALLOW.getValue())
                        .actions(List.of(
                                PolicyActions.GET_OBJECT,
                                PolicyActions.LIST_BUCKET,
                                PolicyActions.LIST_ALL_MY_BUCKETS))
                        .resources(List.of("*"))
                        .build()))
                .build();
    }

    /**
     * @return template name to document, in display order
     */
    public static Map<String, PolicyDocument> all() {
        Map<String, PolicyDocument> templates = new LinkedHashMap<>();
        templates.put("DenyAll", denyAll());
        templates.put("ReadOnly", readOnly());
        return templates;
    }
}
