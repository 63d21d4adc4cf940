package com.skilllens.readiness.path;

import com.skilllens.readiness.error.CycleException;
import com.skilllens.readiness.graph.SkillGraph;
import com.skilllens.readiness.graph.SkillGraphModels.Importance;
import com.skilllens.readiness.graph.SkillGraphModels.Skill;
import com.skilllens.readiness.path.LearningPathModels.LearningPath;
import com.skilllens.readiness.path.LearningPathModels.LearningStep;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class LearningPathPlannerTest {
    private final LearningPathPlanner planner = new LearningPathPlanner();

    @Test
    void ordersDockerBeforeKubernetes() {
        SkillGraph graph = new SkillGraph();
        graph.addSkill(new Skill("Docker", "DevOps", 3, 3, 90));
        graph.addSkill(new Skill("Kubernetes", "DevOps", 5, 5, 85));
        graph.addPrerequisite("Kubernetes", "Docker", Importance.REQUIRED);

        LearningPath path = planner.plan("DevOps Engineer", List.of("Kubernetes", "Docker"), Set.of(), graph);

        assertEquals(List.of("Docker", "Kubernetes"), path.skills());
        LearningStep kubernetes = path.steps().get(1);
        assertEquals(2, kubernetes.position());
        assertTrue(kubernetes.unmetPrerequisites().isEmpty());
        assertEquals(8, path.totalWeeks());
        assertEquals("2 months", path.totalEstimatedTime());
    }

    @Test
    void prefersEasierSkillsThenNameAmongReadyNodes() {
        SkillGraph graph = new SkillGraph();
        graph.addSkill(new Skill("Rust", "Programming", 5));
        graph.addSkill(new Skill("Go", "Programming", 3));
        graph.addSkill(new Skill("Bash", "Tools", 3));
        graph.addSkill(new Skill("HTML", "Web", 1));

        LearningPath path = planner.plan("R", List.of("Rust", "Go", "Bash", "HTML"), Set.of(), graph);

        assertEquals(List.of("HTML", "Bash", "Go", "Rust"), path.skills());
        assertEquals(List.of(1, 2, 3, 4), path.steps().stream().map(LearningStep::position).toList());
    }

    @Test
    void recordsSatisfiedPrerequisitesAsContextOnly() {
        SkillGraph graph = new SkillGraph();
        graph.addSkill(new Skill("Python", "Programming", 2));
        graph.addSkill(new Skill("SQL", "Database", 2));
        graph.addSkill(new Skill("ETL", "Data Engineering", 3));
        graph.addPrerequisite("ETL", "SQL", Importance.REQUIRED);
        graph.addPrerequisite("ETL", "Python", Importance.RECOMMENDED);

        LearningPath path = planner.plan("R", List.of("ETL", "Python"), Set.of("SQL"), graph);

        assertEquals(List.of("Python", "ETL"), path.skills());
        LearningStep etl = path.steps().get(1);
        assertEquals(List.of("SQL"), etl.satisfiedPrerequisites());
        assertTrue(etl.unmetPrerequisites().isEmpty());
        assertEquals("Data Engineering", etl.category());
    }

    @Test
    void reportsPrerequisitesLeftOutOfThePlan() {
        SkillGraph graph = new SkillGraph();
        graph.addSkill(new Skill("Scala", "Programming", 4));
        graph.addSkill(new Skill("Spark", "Big Data", 5));
        graph.addPrerequisite("Spark", "Scala", Importance.RECOMMENDED);

        LearningPath path = planner.plan("R", List.of("Spark"), Set.of(), graph);

        assertEquals(List.of("Scala"), path.steps().get(0).unmetPrerequisites());
    }

    @Test
    void skillsOutsideTheCatalogGetDefaults() {
        LearningPath path = planner.plan("R", List.of("COBOL"), Set.of(), new SkillGraph());

        LearningStep step = path.steps().get(0);
        assertEquals("Unknown", step.category());
        assertEquals(3, step.difficulty());
        assertEquals(3, step.estimatedWeeks());
    }

    @Test
    void emptyTargetsGiveEmptyPath() {
        LearningPath path = planner.plan("R", List.of(), Set.of(), new SkillGraph());

        assertTrue(path.steps().isEmpty());
        assertEquals(0, path.totalWeeks());
        assertEquals("0 weeks", path.totalEstimatedTime());
    }

    @Test
    void everyStepComesAfterItsPrerequisitesForRandomGraphs() {
        Random random = new Random(19);
        for (int round = 0; round < 30; round++) {
            SkillGraph graph = new SkillGraph();
            int n = 15;
            for (int i = 0; i < n; i++) graph.addSkill(new Skill("n" + i, "x", 1 + random.nextInt(5)));
            for (int i = 0; i < 30; i++) {
                int a = random.nextInt(n);
                int b = random.nextInt(n);
                if (a > b) graph.addPrerequisite("n" + a, "n" + b, Importance.REQUIRED);
            }
            List<String> targets = new ArrayList<>();
            for (int i = 0; i < n; i++) targets.add("n" + i);

            LearningPath path = planner.plan("R", targets, Set.of(), graph);

            assertEquals(n, path.steps().size());
            Map<String, Integer> position = new HashMap<>();
            path.steps().forEach(s -> position.put(s.skill(), s.position()));
            for (LearningStep step : path.steps()) {
                assertTrue(step.unmetPrerequisites().isEmpty(), step.skill());
                for (String prereq : graph.prerequisitesOf(step.skill(), false)) {
                    assertTrue(position.get(prereq) < step.position(), prereq + " before " + step.skill());
                }
            }
        }
    }

    @Test
    void undrainableSubgraphRaisesCycleError() {
        Map<String, Set<String>> cyclic = new HashMap<>();
        cyclic.put("A", Set.of("C"));
        cyclic.put("B", Set.of("A"));
        cyclic.put("C", Set.of("B"));
        cyclic.put("D", Set.of());

        CycleException ex = assertThrows(CycleException.class,
                () -> LearningPathPlanner.topologicalOrder(cyclic, Comparator.naturalOrder()));
        assertTrue(ex.getMessage().contains("[A, B, C]"));
    }

    @Test
    void formatsTotalsAsMonthsAndWeeks() {
        assertEquals("1 week", LearningPathPlanner.formatWeeks(1));
        assertEquals("3 weeks", LearningPathPlanner.formatWeeks(3));
        assertEquals("1 month", LearningPathPlanner.formatWeeks(4));
        assertEquals("2 months 1 week", LearningPathPlanner.formatWeeks(9));
        assertEquals("3 months 3 weeks", LearningPathPlanner.formatWeeks(15));
    }

    @Test
    void keepsOrderThroughSkillsOutsideThePlan() {
        SkillGraph graph = new SkillGraph();
        graph.addSkill(new Skill("Data Pipeline", "Data Engineering", 1));
        graph.addSkill(new Skill("Apache Spark", "Big Data", 3));
        graph.addSkill(new Skill("Scala", "Programming", 5));
        graph.addPrerequisite("Data Pipeline", "Apache Spark", Importance.RECOMMENDED);
        graph.addPrerequisite("Apache Spark", "Scala", Importance.REQUIRED);

        LearningPath leftOut = planner.plan("R", List.of("Data Pipeline", "Scala"), Set.of(), graph);
        assertEquals(List.of("Scala", "Data Pipeline"), leftOut.skills());
        assertEquals(List.of("Apache Spark"), leftOut.steps().get(1).unmetPrerequisites());

        LearningPath known = planner.plan("R", List.of("Data Pipeline", "Scala"), Set.of("Apache Spark"), graph);
        assertEquals(List.of("Scala", "Data Pipeline"), known.skills());
        assertEquals(List.of("Apache Spark"), known.steps().get(1).satisfiedPrerequisites());
    }
}
