package de.jwiegmann.distribution.control;

import de.jwiegmann.distribution.control.dto.AgentAssignment;
import de.jwiegmann.distribution.control.dto.ContactItem;
import de.jwiegmann.distribution.control.dto.DistributionPlan;
import de.jwiegmann.distribution.control.exception.UploadValidationException;
import de.jwiegmann.distribution.entity.Agent;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.http.HttpStatus;

import java.util.List;

import static de.jwiegmann.distribution.fixture.ContactFixtures.agents;
import static de.jwiegmann.distribution.fixture.ContactFixtures.contacts;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class DistributionEngineTest {

    private final DistributionEngine engine = new DistributionEngine(5, 10);

    @Test
    void ten_items_five_agents_two_each() {
        DistributionPlan plan = engine.plan(contacts(10), agents(5), null);

        assertThat(plan.getTotalAgents()).isEqualTo(5);
        assertThat(plan.getItemsPerAgent()).isEqualTo(2);
        assertThat(plan.getRemainderItems()).isZero();
        assertThat(plan.getAssignments()).extracting(AgentAssignment::getItemCount).containsExactly(2, 2, 2, 2, 2);
    }

    @Test
    void remainder_goes_to_first_agents_in_roster_order() {
        DistributionPlan plan = engine.plan(contacts(12), agents(5), null);

        assertThat(plan.getItemsPerAgent()).isEqualTo(2);
        assertThat(plan.getRemainderItems()).isEqualTo(2);
        assertThat(plan.getAssignments()).extracting(AgentAssignment::getAgentId, AgentAssignment::getItemCount)
                .containsExactly(
                        tuple("agent-1", 3),
                        tuple("agent-2", 3),
                        tuple("agent-3", 2),
                        tuple("agent-4", 2),
                        tuple("agent-5", 2));
    }

    @Test
    void partition_laws_hold_for_all_small_inputs() {
        for (int n = 1; n <= 40; n++) {
            for (int a = 1; a <= 10; a++) {
                List<ContactItem> items = contacts(n);
                DistributionPlan plan = engine.plan(items, agents(a), 10);

                int base = n / a;
                int remainder = n % a;
                List<Integer> counts = plan.getAssignments().stream().map(AgentAssignment::getItemCount).toList();

                assertThat(plan.getTotalAgents()).isEqualTo(a);
                assertThat(counts.stream().mapToInt(Integer::intValue).sum()).isEqualTo(n);
                assertThat(counts).allMatch(c -> c == base || c == base + 1);
                for (int i = 0; i < a; i++) {
                    assertThat(counts.get(i)).isEqualTo(i < remainder ? base + 1 : base);
                }

                // Zusammengesetzt ergibt sich exakt die Eingabe
                List<ContactItem> concatenated = plan.getAssignments().stream()
                        .flatMap(assignment -> assignment.getItems().stream())
                        .toList();
                assertThat(concatenated).isEqualTo(items);
            }
        }
    }

    @Test
    void same_input_same_plan() {
        DistributionPlan first = engine.plan(contacts(23), agents(7), 7);
        DistributionPlan second = engine.plan(contacts(23), agents(7), 7);

        assertThat(second).isEqualTo(first);
    }

    @Test
    void fewer_items_than_agents() {
        DistributionPlan plan = engine.plan(contacts(3), agents(5), null);

        assertThat(plan.getItemsPerAgent()).isZero();
        assertThat(plan.getRemainderItems()).isEqualTo(3);
        assertThat(plan.getAssignments()).extracting(AgentAssignment::getItemCount).containsExactly(1, 1, 1, 0, 0);
    }

    @Test
    void target_count_limits_participants_to_first_agents() {
        DistributionPlan plan = engine.plan(contacts(9), agents(7), 3);

        assertThat(plan.getTotalAgents()).isEqualTo(3);
        assertThat(plan.getAssignments()).extracting(AgentAssignment::getAgentId)
                .containsExactly("agent-1", "agent-2", "agent-3");
    }

    @Test
    void default_target_is_capped_by_roster() {
        assertThat(engine.plan(contacts(4), agents(2), null).getTotalAgents()).isEqualTo(2);
        assertThat(engine.plan(contacts(4), agents(8), null).getTotalAgents()).isEqualTo(5);
    }

    @Test
    void engine_does_not_reorder_the_roster() {
        List<Agent> roster = List.of(agents(3).get(2), agents(3).get(0), agents(3).get(1));

        DistributionPlan plan = engine.plan(contacts(4), roster, null);

        assertThat(plan.getAssignments().get(0).getAgentId()).isEqualTo("agent-3");
        assertThat(plan.getAssignments().get(0).getItemCount()).isEqualTo(2);
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -1, 11})
    void rejects_target_count_out_of_range(int target) {
        assertThatThrownBy(() -> engine.plan(contacts(5), agents(5), target))
                .isInstanceOfSatisfying(UploadValidationException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo("INVALID_TARGET_AGENT_COUNT"));
    }

    @Test
    void rejects_empty_roster() {
        assertThatThrownBy(() -> engine.plan(contacts(5), List.of(), null))
                .isInstanceOfSatisfying(UploadValidationException.class, e -> {
                    assertThat(e.getErrorCode()).isEqualTo("NO_ACTIVE_AGENTS");
                    assertThat(e.getStatus()).isEqualTo(HttpStatus.CONFLICT);
                });
    }

    @Test
    void summary_covers_all_items() {
        DistributionPlan plan = engine.plan(contacts(17), agents(4), null);

        assertThat(plan.toSummary().coveredItems()).isEqualTo(17);
    }
}
