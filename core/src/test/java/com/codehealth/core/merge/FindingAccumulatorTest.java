package com.codehealth.core.merge;

import com.codehealth.core.model.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.codehealth.core.testutil.TestFindings.base;
import static org.assertj.core.api.Assertions.assertThat;

class FindingAccumulatorTest {

    @Test
    @DisplayName("표기만 다른 summary는 한 레코드로 병합")
    void summaryVariants_collapse() {
        FindingAccumulator acc = new FindingAccumulator();
        acc.add(base().summary("Unused func").build());
        acc.add(base().summary("unused   FUNC!!").build());
        acc.add(base().summary("  unused-func ").build());

        assertThat(acc.size()).isEqualTo(1);
        assertThat(acc.folded()).isEqualTo(3);
        assertThat(acc.snapshot().get(0).getSources()).hasSize(3);
    }

    @Test
    @DisplayName("detector / file / summary 중 하나라도 다르면 분리")
    void differingKeyFields_stayApart() {
        FindingAccumulator acc = new FindingAccumulator();
        acc.add(base().build());
        acc.add(base().detector(Detector.DUPLICATION).build());
        acc.add(base().file("b.go").build());
        acc.add(base().summary("unused var").build());

        assertThat(acc.size()).isEqualTo(4);
    }

    @Test
    void snapshot_keepsFirstSeenOrder_andIsACopy() {
        FindingAccumulator acc = new FindingAccumulator();
        acc.add(base().file("z.go").build());
        acc.add(base().file("a.go").build());

        List<MergedFinding> snap = acc.snapshot();
        assertThat(snap).extracting(MergedFinding::getFile).containsExactly("z.go", "a.go");

        snap.clear();
        assertThat(acc.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("무작위 입력: 병합 결과는 기여 레코드 중 가장 강한 값, 크기 ≤ 입력")
    void randomizedFold_isMonotonicAndOrderIndependent() {
        Random rnd = new Random(42);
        List<Finding> input = new ArrayList<>();
        for (int i = 0; i < 300; i++) {
            input.add(base()
                    .detector(pick(rnd, Detector.values()))
                    .file("f" + rnd.nextInt(3) + ".go")
                    .summary("issue " + rnd.nextInt(4))
                    .tier(pick(rnd, Tier.values()))
                    .severity(pick(rnd, Severity.values()))
                    .confidence(pick(rnd, Confidence.values()))
                    .status(pick(rnd, Status.values()))
                    .line(rnd.nextInt(50))
                    .needsValidation(rnd.nextInt(10) == 0)
                    .source("task-" + i + ".json")
                    .build());
        }

        FindingAccumulator forward = new FindingAccumulator();
        forward.addAll(input);
        List<Finding> shuffled = new ArrayList<>(input);
        Collections.shuffle(shuffled, new Random(7));
        FindingAccumulator backward = new FindingAccumulator();
        backward.addAll(shuffled);

        assertThat(forward.size()).isLessThanOrEqualTo(input.size());
        assertThat(backward.size()).isEqualTo(forward.size());

        Map<String, List<Finding>> groups = input.stream()
                .collect(Collectors.groupingBy(f -> com.codehealth.core.merge.dedupe.Fingerprint.of(f).key()));
        Map<String, MergedFinding> other = backward.snapshot().stream()
                .collect(Collectors.toMap(MergedFinding::getFingerprint, Function.identity()));

        for (MergedFinding m : forward.snapshot()) {
            List<Finding> group = groups.get(m.getFingerprint());
            int maxTier = group.stream().mapToInt(f -> f.getTier().rank()).max().orElseThrow();
            int maxSev = group.stream().mapToInt(f -> f.getSeverity().rank()).max().orElseThrow();
            int maxConf = group.stream().mapToInt(f -> f.getConfidence().rank()).max().orElseThrow();
            boolean anyOpen = group.stream().anyMatch(f -> f.getStatus() == Status.OPEN);

            assertThat(m.getTier().rank()).isEqualTo(maxTier);
            assertThat(m.getSeverity().rank()).isEqualTo(maxSev);
            assertThat(m.getConfidence().rank()).isEqualTo(maxConf);
            if (anyOpen) assertThat(m.getStatus()).isEqualTo(Status.OPEN);
            assertThat(m.getSources()).hasSize(group.size());

            MergedFinding o = other.get(m.getFingerprint());
            assertThat(o.getTier()).isEqualTo(m.getTier());
            assertThat(o.getSeverity()).isEqualTo(m.getSeverity());
            assertThat(o.getConfidence()).isEqualTo(m.getConfidence());
            assertThat(o.getLine()).isEqualTo(m.getLine());
            assertThat(o.getSources()).containsExactlyInAnyOrderElementsOf(m.getSources());
            if (anyOpen) assertThat(o.getStatus()).isEqualTo(Status.OPEN);
        }
    }

    private static <E> E pick(Random rnd, E[] values) {
        return values[rnd.nextInt(values.length)];
    }
}
