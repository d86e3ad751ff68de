package com.codehealth.core.merge;

import com.codehealth.core.model.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.codehealth.core.testutil.TestFindings.base;
import static org.assertj.core.api.Assertions.assertThat;

class FindingReconcilerTest {

    @Test
    @DisplayName("seed: 입력 필드를 그대로 옮기고 id는 pending")
    void seed_copiesFields() {
        MergedFinding m = FindingReconciler.seed(base().needsValidation(true).conflictNote("manual check").build());

        assertThat(m.getId()).isEqualTo(MergedFinding.PENDING_ID);
        assertThat(m.getFingerprint()).isEqualTo("dead_unused_code|a.go|unused func");
        assertThat(m.getTier()).isEqualTo(Tier.T1);
        assertThat(m.getLine()).isEqualTo(10);
        assertThat(m.isNeedsValidation()).isTrue();
        assertThat(m.getConflictNote()).isEqualTo("manual check");
        assertThat(m.getSources()).containsExactly("runs/r1/findings/task-001.json");
    }

    @Test
    @DisplayName("동일 레코드 재접기: 충돌 없음, 출처만 증가")
    void identicalFold_noConflict() {
        MergedFinding m = FindingReconciler.seed(base().build());
        MergedFinding r = FindingReconciler.reconcile(m, base().source("runs/r1/findings/task-002.json").build());

        assertThat(r.isNeedsValidation()).isFalse();
        assertThat(r.getConflictNote()).isEmpty();
        assertThat(r.getEvidence()).isEqualTo("func foo() is never referenced");
        assertThat(r.getSources()).containsExactly(
                "runs/r1/findings/task-001.json", "runs/r1/findings/task-002.json");
    }

    @Test
    @DisplayName("입력 병합 레코드는 변경되지 않는다")
    void reconcile_doesNotMutateExisting() {
        MergedFinding m = FindingReconciler.seed(base().tier(Tier.T2).build());
        FindingReconciler.reconcile(m, base().tier(Tier.T1).build());

        assertThat(m.getTier()).isEqualTo(Tier.T2);
        assertThat(m.isNeedsValidation()).isFalse();
        assertThat(m.getSources()).hasSize(1);
    }

    @Nested
    @DisplayName("rank fields")
    class RankFields {
        @Test
        @DisplayName("T2 + T1 ⇒ T1, needs_validation, 'tier: T2 vs T1'")
        void strongerTierWins_andConflictRecorded() {
            MergedFinding m = FindingReconciler.seed(base().tier(Tier.T2).build());
            MergedFinding r = FindingReconciler.reconcile(m, base().tier(Tier.T1).build());

            assertThat(r.getTier()).isEqualTo(Tier.T1);
            assertThat(r.isNeedsValidation()).isTrue();
            assertThat(r.getConflictNote()).contains("tier: T2 vs T1");
        }

        @Test
        @DisplayName("약한 값이 들어와도 약해지지 않는다")
        void weakerCandidate_neverWeakens() {
            MergedFinding m = FindingReconciler.seed(base().build());
            MergedFinding r = FindingReconciler.reconcile(m,
                    base().tier(Tier.T4).severity(Severity.LOW).confidence(Confidence.MED).build());

            assertThat(r.getTier()).isEqualTo(Tier.T1);
            assertThat(r.getSeverity()).isEqualTo(Severity.HIGH);
            assertThat(r.getConfidence()).isEqualTo(Confidence.HIGH);
            assertThat(r.getConflictNote())
                    .isEqualTo("confidence: high vs med; severity: high vs low; tier: T1 vs T4");
        }

        @Test
        void sameConflictTwice_isNotDuplicatedInNote() {
            MergedFinding m = FindingReconciler.seed(base().build());
            m = FindingReconciler.reconcile(m, base().tier(Tier.T2).build());
            m = FindingReconciler.reconcile(m, base().tier(Tier.T2).build());

            assertThat(m.getConflictNote()).isEqualTo("tier: T1 vs T2");
            assertThat(m.getSources()).hasSize(3);
        }

        @Test
        @DisplayName("입력 노트 원문은 다시 쪼개거나 공백을 바꾸지 않는다")
        void existingNoteText_isNotReformatted() {
            MergedFinding m = FindingReconciler.seed(base().tier(Tier.T2).conflictNote("a;b").build());
            MergedFinding r = FindingReconciler.reconcile(m, base().tier(Tier.T1).build());
            r = FindingReconciler.reconcile(r, base().tier(Tier.T2).build());

            assertThat(r.getConflictNote()).isEqualTo("a;b; tier: T2 vs T1; tier: T1 vs T2");
        }

        @Test
        void existingNoteIsKept_andConflictsAppended() {
            MergedFinding m = FindingReconciler.seed(base().tier(Tier.T2).conflictNote("tasks disagree on scope").build());
            MergedFinding r = FindingReconciler.reconcile(m, base().tier(Tier.T1).build());

            assertThat(r.getConflictNote()).isEqualTo("tasks disagree on scope; tier: T2 vs T1");
        }
    }

    @Nested
    @DisplayName("status")
    class StatusRule {
        @Test
        @DisplayName("fixed + open ⇒ open")
        void fixedThenOpen_isOpen() {
            MergedFinding m = FindingReconciler.seed(base().status(Status.FIXED).build());
            MergedFinding r = FindingReconciler.reconcile(m, base().status(Status.OPEN).build());

            assertThat(r.getStatus()).isEqualTo(Status.OPEN);
            assertThat(r.isNeedsValidation()).isTrue();
            assertThat(r.getConflictNote()).isEqualTo("status: fixed vs open");
        }

        @Test
        @DisplayName("open + fixed ⇒ open")
        void openThenFixed_staysOpen() {
            MergedFinding m = FindingReconciler.seed(base().build());
            MergedFinding r = FindingReconciler.reconcile(m, base().status(Status.FIXED).build());

            assertThat(r.getStatus()).isEqualTo(Status.OPEN);
        }

        @Test
        @DisplayName("fixed + wontfix ⇒ 현재값(fixed) 유지, 충돌 기록")
        void closedVsClosed_keepsCurrent() {
            MergedFinding m = FindingReconciler.seed(base().status(Status.FIXED).build());
            MergedFinding r = FindingReconciler.reconcile(m, base().status(Status.WONTFIX).build());

            assertThat(r.getStatus()).isEqualTo(Status.FIXED);
            assertThat(r.getConflictNote()).isEqualTo("status: fixed vs wontfix");
        }
    }

    @Nested
    @DisplayName("text and location")
    class TextFields {
        @Test
        void longerSummaryWins_withoutConflict() {
            MergedFinding m = FindingReconciler.seed(base().build());
            MergedFinding r = FindingReconciler.reconcile(m, base().summary("Unused func!").build());

            assertThat(r.getSummary()).isEqualTo("Unused func!");
            assertThat(r.isNeedsValidation()).isFalse();
        }

        @Test
        void evidence_isConcatenatedWithoutExactRepeats() {
            MergedFinding m = FindingReconciler.seed(base().evidence("a || b").build());
            MergedFinding r = FindingReconciler.reconcile(m, base().evidence("b || c").build());
            r = FindingReconciler.reconcile(r, base().evidence("").build());

            assertThat(r.getEvidence()).isEqualTo("a || b || c");
        }

        @Test
        void smallestPositiveLineWins() {
            MergedFinding m = FindingReconciler.seed(base().line(10).build());
            m = FindingReconciler.reconcile(m, base().line(null).build());
            assertThat(m.getLine()).isEqualTo(10);

            m = FindingReconciler.reconcile(m, base().line(4).build());
            assertThat(m.getLine()).isEqualTo(4);

            m = FindingReconciler.reconcile(m, base().line(0).build());
            assertThat(m.getLine()).isEqualTo(4);
        }

        @Test
        void absentLine_takesFirstPositive() {
            MergedFinding m = FindingReconciler.seed(base().line(null).build());
            MergedFinding r = FindingReconciler.reconcile(m, base().line(7).build());

            assertThat(r.getLine()).isEqualTo(7);
        }

        @Test
        @DisplayName("recommended_fix: 빈 값은 무시, 다르면 충돌 + 긴 쪽")
        void recommendedFix_rules() {
            MergedFinding m = FindingReconciler.seed(base().build());

            MergedFinding empty = FindingReconciler.reconcile(m, base().recommendedFix("").build());
            assertThat(empty.getRecommendedFix()).isEqualTo("remove foo");
            assertThat(empty.isNeedsValidation()).isFalse();

            MergedFinding longer = FindingReconciler.reconcile(m, base().recommendedFix("remove foo and its test").build());
            assertThat(longer.getRecommendedFix()).isEqualTo("remove foo and its test");
            assertThat(longer.getConflictNote()).isEqualTo("recommended_fix differs");
            assertThat(longer.isNeedsValidation()).isTrue();

            MergedFinding shorter = FindingReconciler.reconcile(m, base().recommendedFix("rm").build());
            assertThat(shorter.getRecommendedFix()).isEqualTo("remove foo");
            assertThat(shorter.isNeedsValidation()).isTrue();
        }
    }

    @Test
    @DisplayName("needs_validation은 한 번 true면 계속 true")
    void needsValidation_isSticky() {
        MergedFinding m = FindingReconciler.seed(base().build());
        m = FindingReconciler.reconcile(m, base().needsValidation(true).build());
        assertThat(m.isNeedsValidation()).isTrue();
        assertThat(m.getConflictNote()).isEmpty();

        m = FindingReconciler.reconcile(m, base().build());
        assertThat(m.isNeedsValidation()).isTrue();
    }

    @Test
    void appendNote_sortsAndDedupes() {
        String note = FindingReconciler.appendNote("", List.of("tier: T2 vs T1", "status: fixed vs open", "tier: T2 vs T1"));
        assertThat(note).isEqualTo("status: fixed vs open; tier: T2 vs T1");
    }
}
