package com.regdoc.acquirer.crawl.match;

import com.regdoc.acquirer.crawl.model.MatchCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Picks the best candidate for a target name. Stateless and safe to share.
 *
 * <p>Ordering among candidates that clear {@link #ACCEPTANCE_THRESHOLD} is validity first
 * (confirmed in force beats everything else), then score, then the source's own rank.
 */
@Component
public class MatchResolver {
    private static final Logger log = LoggerFactory.getLogger(MatchResolver.class);

    public static final double ACCEPTANCE_THRESHOLD = 0.6;
    static final double EXACT_BONUS = 0.2;
    static final double CONTAINMENT_BONUS = 0.3;
    static final double KEYWORD_BONUS_EACH = 0.05;
    static final double KEYWORD_BONUS_CAP = 0.15;
    static final double CLASS_MISMATCH_PENALTY = 0.5;

    private static final Comparator<ScoredCandidate> PREFERENCE = Comparator
        .comparing((ScoredCandidate scored) -> scored.validity().isConfirmedInForce() ? 0 : 1)
        .thenComparing(ScoredCandidate::score, Comparator.reverseOrder())
        .thenComparing(scored -> scored.candidate().rank(), Comparator.nullsLast(Comparator.naturalOrder()));

    public Optional<MatchCandidate> resolve(String targetName, List<MatchCandidate> candidates) {
        return resolveScored(targetName, candidates).map(ScoredCandidate::candidate);
    }

    public Optional<ScoredCandidate> resolveScored(String targetName, List<MatchCandidate> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }
        String target = NameNormalizer.normalize(targetName);
        List<ScoredCandidate> accepted = new ArrayList<>();
        for (MatchCandidate candidate : candidates) {
            if (candidate == null || candidate.title() == null) {
                continue;
            }
            double score = score(target, NameNormalizer.normalize(candidate.title()));
            if (score >= ACCEPTANCE_THRESHOLD) {
                accepted.add(new ScoredCandidate(candidate, score, ValidityStatus.fromLabel(candidate.statusLabel())));
            }
        }
        if (accepted.isEmpty()) {
            log.debug("No candidate for '{}' cleared {} among {} hits", targetName, ACCEPTANCE_THRESHOLD, candidates.size());
            return Optional.empty();
        }
        accepted.sort(PREFERENCE);
        ScoredCandidate winner = accepted.get(0);
        log.debug(
            "Resolved '{}' to '{}' (score {}, {})",
            targetName,
            winner.candidate().title(),
            String.format(Locale.ROOT, "%.2f", winner.score()),
            winner.validity()
        );
        return Optional.of(winner);
    }

    public double score(String target, String title) {
        if (target.isEmpty() || title.isEmpty()) {
            return 0.0;
        }
        double score = similarity(target, title);
        if (target.equals(title)) {
            score += EXACT_BONUS;
        } else if (title.contains(target) || target.contains(title)) {
            double ratio = (double) Math.min(target.length(), title.length()) / Math.max(target.length(), title.length());
            score += CONTAINMENT_BONUS * ratio;
        }
        score += keywordBonus(target, title);
        if (classesConflict(DocumentClass.of(target), DocumentClass.of(title))) {
            score -= CLASS_MISMATCH_PENALTY;
        }
        return Math.max(0.0, Math.min(1.0, score));
    }

    // OTHER only conflicts with an interpretation.
    static boolean classesConflict(DocumentClass target, DocumentClass title) {
        if (target == title) {
            return false;
        }
        if (target == DocumentClass.INTERPRETATION || title == DocumentClass.INTERPRETATION) {
            return true;
        }
        return target != DocumentClass.OTHER && title != DocumentClass.OTHER;
    }

    private double keywordBonus(String target, String title) {
        Set<String> targetKeywords = NameNormalizer.keywords(target);
        Set<String> titleKeywords = NameNormalizer.keywords(title);
        long shared = targetKeywords.stream().filter(titleKeywords::contains).count();
        return Math.min(KEYWORD_BONUS_CAP, shared * KEYWORD_BONUS_EACH);
    }

    static double similarity(String a, String b) {
        int longer = Math.max(a.length(), b.length());
        if (longer == 0) {
            return 1.0;
        }
        return 1.0 - (double) levenshtein(a, b) / longer;
    }

    private static int levenshtein(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}
