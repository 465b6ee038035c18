package graphql.consulting.federation.plan;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import graphql.PublicApi;
import graphql.language.Field;
import graphql.language.InlineFragment;
import graphql.language.Selection;
import graphql.language.SelectionSet;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static graphql.Assert.assertShouldNeverHappen;

/**
 * Renders a {@link QueryPlan} into the structure executors consume. Rendering is pure: the same plan
 * always gives the same output.
 */
@PublicApi
public class QueryPlanSerializer {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    public static Map<String, Object> toMap(QueryPlan queryPlan) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("kind", "QueryPlan");
        if (queryPlan.getNode() != null) {
            result.put("node", nodeToMap(queryPlan.getNode()));
        }
        return result;
    }

    public static String toJson(QueryPlan queryPlan) {
        try {
            return OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(toMap(queryPlan));
        } catch (JsonProcessingException e) {
            return assertShouldNeverHappen("query plan can not be rendered: %s", e.getMessage());
        }
    }

    private static Map<String, Object> nodeToMap(PlanNode node) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("kind", node.getKind().getDisplayName());
        switch (node.getKind()) {
            case FETCH:
                fetchToMap((FetchNode) node, result);
                break;
            case FLATTEN:
                FlattenNode flattenNode = (FlattenNode) node;
                result.put("path", new ArrayList<>(flattenNode.getPathSegments()));
                result.put("node", nodeToMap(flattenNode.getNode()));
                break;
            default:
                List<Object> nodes = new ArrayList<>();
                for (PlanNode child : node.getChildren()) {
                    nodes.add(nodeToMap(child));
                }
                result.put("nodes", nodes);
        }
        return result;
    }

    private static void fetchToMap(FetchNode fetchNode, Map<String, Object> result) {
        result.put("serviceName", fetchNode.getServiceName());
        if (!fetchNode.getRequires().isEmpty()) {
            List<Object> requires = new ArrayList<>();
            for (InlineFragment inlineFragment : fetchNode.getRequires()) {
                requires.add(selectionToMap(inlineFragment));
            }
            result.put("requires", requires);
        }
        result.put("variableUsages", new ArrayList<>(fetchNode.getVariableUsages()));
        result.put("operation", fetchNode.getOperation());
        if (fetchNode.getOperationName() != null) {
            result.put("operationName", fetchNode.getOperationName());
        }
        result.put("operationKind", fetchNode.getOperationKind());
        if (!fetchNode.getInputRewrites().isEmpty()) {
            List<Object> rewrites = new ArrayList<>();
            for (InputRewrite inputRewrite : fetchNode.getInputRewrites()) {
                Map<String, Object> rewrite = new LinkedHashMap<>();
                rewrite.put("kind", inputRewrite.getKind());
                rewrite.put("path", new ArrayList<>(inputRewrite.getPath()));
                rewrite.put("setValueTo", inputRewrite.getSetValueTo());
                rewrites.add(rewrite);
            }
            result.put("inputRewrites", rewrites);
        }
    }

    private static Map<String, Object> selectionToMap(Selection<?> selection) {
        Map<String, Object> result = new LinkedHashMap<>();
        SelectionSet selectionSet;
        if (selection instanceof InlineFragment) {
            InlineFragment inlineFragment = (InlineFragment) selection;
            result.put("kind", "InlineFragment");
            if (inlineFragment.getTypeCondition() != null) {
                result.put("typeCondition", inlineFragment.getTypeCondition().getName());
            }
            selectionSet = inlineFragment.getSelectionSet();
        } else {
            Field field = (Field) selection;
            result.put("kind", "Field");
            result.put("name", field.getName());
            selectionSet = field.getSelectionSet();
        }
        if (selectionSet != null) {
            List<Object> selections = new ArrayList<>();
            for (Selection<?> child : selectionSet.getSelections()) {
                selections.add(selectionToMap(child));
            }
            result.put("selections", selections);
        }
        return result;
    }
}
