package graphql.consulting.federation.planning;

import graphql.consulting.federation.QueryPlannerConfiguration;
import graphql.consulting.federation.schema.FieldSet;
import graphql.consulting.federation.schema.Subgraph;
import graphql.execution.ResultPath;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FetchGroupOptimizerTest {

    private static final Subgraph ACCOUNTS = new Subgraph("accounts", "http://accounts", "ACCOUNTS");
    private static final Subgraph REVIEWS = new Subgraph("reviews", "http://reviews", "REVIEWS");
    private static final ResultPath ME = ResultPath.rootPath().segment("me");

    private static FetchGroup rootGroup(int id, Subgraph subgraph, String field) {
        FetchGroup group = new FetchGroup(id, subgraph, false, false, ResultPath.rootPath());
        group.getSelection().plainField(field, false);
        return group;
    }

    private static FetchGroup entityGroup(int id, Subgraph subgraph, ResultPath path, String field, FetchGroup... dependencies) {
        FetchGroup group = new FetchGroup(id, subgraph, true, false, path);
        group.addInput("User", FieldSet.parse("__typename id"));
        if (field != null) {
            group.getSelection().inlineFragment("User").plainField(field, false);
        }
        group.addDependencies(Arrays.asList(dependencies));
        return group;
    }

    private static List<FetchGroup> optimize(QueryPlannerConfiguration configuration, FetchGroup... groups) {
        return new FetchGroupOptimizer(configuration).optimize(Arrays.asList(groups));
    }

    @Test
    void removesEmptyGroupsAndKeepsTheirDependencies() {
        FetchGroup root = rootGroup(0, ACCOUNTS, "me");
        FetchGroup empty = entityGroup(1, REVIEWS, ME, null, root);
        FetchGroup dependent = entityGroup(2, ACCOUNTS, ME, "name", empty);

        List<FetchGroup> result = optimize(QueryPlannerConfiguration.defaultConfiguration(), root, empty, dependent);

        assertThat(result).containsExactly(root, dependent);
        assertThat(dependent.getDependencies()).containsExactly(root);
    }

    @Test
    void mergesSiblingEntityGroups() {
        FetchGroup root = rootGroup(0, ACCOUNTS, "me");
        FetchGroup first = entityGroup(1, REVIEWS, ME, "reviews", root);
        FetchGroup second = entityGroup(2, REVIEWS, ME, "username", root);
        FetchGroup after = entityGroup(3, ACCOUNTS, ME, "name", second);

        List<FetchGroup> result = optimize(QueryPlannerConfiguration.defaultConfiguration(), root, first, second, after);

        assertThat(result).containsExactly(root, first, after);
        assertThat(first.getSelection().getInlineFragment("User").containsAll(FieldSet.parse("reviews username"))).isTrue();
        assertThat(after.getDependencies()).containsExactly(first);
    }

    @Test
    void mergesUnorderedGroupsThatWaitForDifferentGroups() {
        FetchGroup root = rootGroup(0, ACCOUNTS, "me");
        FetchGroup other = entityGroup(1, ACCOUNTS, ME, "name", root);
        FetchGroup first = entityGroup(2, REVIEWS, ME, "reviews", root);
        FetchGroup second = entityGroup(3, REVIEWS, ME, "username", root, other);

        List<FetchGroup> result = optimize(QueryPlannerConfiguration.defaultConfiguration(), root, other, first, second);

        assertThat(result).containsExactly(root, other, first);
        assertThat(first.getSelection().getInlineFragment("User").containsAll(FieldSet.parse("reviews username"))).isTrue();
        assertThat(first.getDependencies()).containsExactly(other);
    }

    @Test
    void keepsGroupsApartWhenMergingIsTurnedOff() {
        FetchGroup root = rootGroup(0, ACCOUNTS, "me");
        FetchGroup first = entityGroup(1, REVIEWS, ME, "reviews", root);
        FetchGroup second = entityGroup(2, REVIEWS, ME, "username", root);

        List<FetchGroup> result = optimize(QueryPlannerConfiguration.newConfiguration().mergeSiblingFetches(false).build(), root, first, second);

        assertThat(result).containsExactly(root, first, second);
    }

    @Test
    void neverMergesGroupsThatDependOnEachOther() {
        FetchGroup root = rootGroup(0, ACCOUNTS, "me");
        FetchGroup first = entityGroup(1, REVIEWS, ME, "reviews", root);
        FetchGroup second = entityGroup(2, REVIEWS, ME, "username", root, first);

        List<FetchGroup> result = optimize(QueryPlannerConfiguration.defaultConfiguration(), root, first, second);

        assertThat(result).containsExactly(root, first, second);
    }

    @Test
    void neverMergesRootGroups() {
        FetchGroup first = rootGroup(0, ACCOUNTS, "me");
        FetchGroup second = rootGroup(1, ACCOUNTS, "user");

        List<FetchGroup> result = optimize(QueryPlannerConfiguration.defaultConfiguration(), first, second);

        assertThat(result).containsExactly(first, second);
    }

    @Test
    void dropsDependenciesImpliedByOthers() {
        FetchGroup root = rootGroup(0, ACCOUNTS, "me");
        FetchGroup middle = entityGroup(1, REVIEWS, ME, "reviews", root);
        FetchGroup last = entityGroup(2, ACCOUNTS, ME, "name", root, middle);

        optimize(QueryPlannerConfiguration.defaultConfiguration(), root, middle, last);

        assertThat(last.getDependencies()).containsExactly(middle);
        assertThat(last.dependsOnTransitively(root)).isTrue();
    }
}
