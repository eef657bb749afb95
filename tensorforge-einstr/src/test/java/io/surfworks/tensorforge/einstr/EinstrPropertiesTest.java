package io.surfworks.tensorforge.einstr;

import io.surfworks.tensorforge.einstr.ValidationException.Rule;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Properties that must hold for every expression, checked over generated subscripts.
 */
class EinstrPropertiesTest {

    private static final String POOL = "abcdefgH";

    @Test
    void contractionOutputsAreBoundByInputs() {
        Random random = new Random(42);
        int valid = 0;
        int invalid = 0;

        for (int trial = 0; trial < 500; trial++) {
            List<String> inputs = randomInputs(random);
            Set<Character> bound = new LinkedHashSet<>();
            inputs.forEach(term -> term.chars().forEach(c -> bound.add((char) c)));

            List<Character> candidates = new ArrayList<>(bound);
            Collections.shuffle(candidates, random);
            StringBuilder output = new StringBuilder();
            candidates.subList(0, random.nextInt(candidates.size() + 1)).forEach(output::append);

            boolean addFree = random.nextInt(10) < 3 && bound.size() < POOL.length();
            if (addFree) {
                for (char c : POOL.toCharArray()) {
                    if (!bound.contains(c)) {
                        output.append(c);
                        break;
                    }
                }
            }

            String subscripts = String.join(",", inputs) + "->" + output;
            int[] ranks = inputs.stream().mapToInt(String::length).toArray();

            if (addFree) {
                ValidationException e = assertThrows(ValidationException.class,
                    () -> Einstr.parseEinsum(subscripts, ranks), subscripts);
                assertEquals(Rule.UNBOUND_OUTPUT_INDEX, e.rule());
                invalid++;
            } else {
                Expression expr = Einstr.parseEinsum(subscripts, ranks);
                assertTrue(expr.inputIndices().containsAll(expr.outputIndices()), subscripts);
                valid++;
            }
        }
        assertTrue(valid > 100 && invalid > 50, "generator should cover both outcomes");
    }

    @Test
    void symbolToIdIsInjective() {
        Random random = new Random(7);

        for (int trial = 0; trial < 300; trial++) {
            List<String> terms = randomInputs(random);
            terms.add(randomTerm(random));
            String subscripts = String.join(",", terms.subList(0, terms.size() - 1)) + "->" + terms.get(terms.size() - 1);
            Expression expr = Einstr.parse(subscripts);

            List<Term> parsed = new ArrayList<>(expr.inputs());
            parsed.addAll(expr.outputs());
            Map<Character, Integer> idOf = new HashMap<>();
            Map<Integer, Character> letterOf = new HashMap<>();
            for (int t = 0; t < terms.size(); t++) {
                String text = terms.get(t);
                List<Integer> ids = parsed.get(t).indices();
                assertEquals(text.length(), ids.size(), subscripts);
                for (int p = 0; p < text.length(); p++) {
                    char letter = text.charAt(p);
                    int id = ids.get(p);
                    assertEquals(id, idOf.computeIfAbsent(letter, k -> id), subscripts);
                    assertEquals(letter, letterOf.computeIfAbsent(id, k -> letter), subscripts);
                }
            }
        }
    }

    @ParameterizedTest
    @CsvSource(delimiter = ';', value = {
        "...ij,jk->...ik; 3,2",
        "i...,...j->(i...)j; 2,3",
        "ij...->(...)ji; 5",
        "...,...->...; 1,4",
        "ab,bc->(ac); 2,2"
    })
    void reparsingCanonicalFormIsIdempotent(String subscripts, String rankList) {
        int[] ranks = Arrays.stream(rankList.split(",")).mapToInt(Integer::parseInt).toArray();
        Expression matched = Einstr.parse(subscripts).match(ranks);
        Expression again = Einstr.parse(matched.toString()).match(ranks);

        assertEquals(normalize(matched), normalize(again));
        assertEquals(matched.toString(), Einstr.parse(again.toString()).match(ranks).toString());
    }

    @Test
    void splitKeepsTheFusedStructure() {
        Random random = new Random(11);
        int checked = 0;

        for (int trial = 0; trial < 300; trial++) {
            List<String> inputs = randomInputs(random);
            List<Character> bound = new ArrayList<>();
            inputs.forEach(term -> term.chars().forEach(c -> {
                if (!bound.contains((char) c)) {
                    bound.add((char) c);
                }
            }));
            if (bound.size() < 2) {
                continue;
            }
            Collections.shuffle(bound, random);
            int cut = 1 + random.nextInt(bound.size() - 1);
            String first = join(bound.subList(0, cut)) + "Z";
            String second = "Z" + join(bound.subList(cut, bound.size()));
            String subscripts = String.join(",", inputs) + "->" + first + "," + second;
            int[] ranks = inputs.stream().mapToInt(String::length).toArray();

            Expression expr = Einstr.parseEinsumsvd(subscripts, ranks);
            SplitExpression split = Einstr.splitEinsumsvd(expr);

            OperationFamily.EINSUM.validator().validate(split.contraction());
            OperationFamily.EINSVD.validator().validate(split.decomposition());
            assertEquals(expr.inputs(), split.contraction().inputs());
            assertEquals(expr.outputs(), split.decomposition().outputs());
            checked++;
        }
        assertTrue(checked > 100);
    }

    @Test
    void concurrentCallsShareNothing() throws Exception {
        List<String> subscripts = List.of("ij,jk->ia,ka", "...ij,...jk->...(ik)", "abc->(ab)c", "ii->i");
        List<String> expected = subscripts.stream()
            .map(s -> Einstr.parse(s).match(ranksFor(s)).toString())
            .toList();

        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Callable<List<String>>> tasks = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                tasks.add(() -> {
                    List<String> results = new ArrayList<>();
                    for (int round = 0; round < 200; round++) {
                        String s = subscripts.get(round % subscripts.size());
                        results.add(Einstr.parse(s).match(ranksFor(s)).toString());
                    }
                    return results;
                });
            }
            for (Future<List<String>> future : executor.invokeAll(tasks)) {
                List<String> results = future.get();
                for (int round = 0; round < results.size(); round++) {
                    assertEquals(expected.get(round % expected.size()), results.get(round));
                }
            }
        } finally {
            executor.shutdownNow();
        }
    }

    // ==================== Helpers ====================

    private static int[] ranksFor(String subscripts) {
        return switch (subscripts) {
            case "ij,jk->ia,ka" -> new int[]{2, 2};
            case "...ij,...jk->...(ik)" -> new int[]{4, 3};
            case "abc->(ab)c" -> new int[]{3};
            default -> new int[]{2};
        };
    }

    private static List<String> randomInputs(Random random) {
        List<String> inputs = new ArrayList<>();
        int count = 1 + random.nextInt(3);
        for (int i = 0; i < count; i++) {
            inputs.add(randomTerm(random));
        }
        return inputs;
    }

    private static String randomTerm(Random random) {
        StringBuilder sb = new StringBuilder();
        int length = random.nextInt(5);
        for (int i = 0; i < length; i++) {
            sb.append(POOL.charAt(random.nextInt(POOL.length())));
        }
        return sb.toString();
    }

    private static String join(List<Character> letters) {
        StringBuilder sb = new StringBuilder();
        letters.forEach(sb::append);
        return sb.toString();
    }

    /**
     * Relabels ids by first appearance so expressions equal up to renaming compare equal.
     */
    private static String normalize(Expression expr) {
        Map<Integer, Integer> relabel = new HashMap<>();
        StringBuilder sb = new StringBuilder();
        for (InputTerm term : expr.inputs()) {
            term.indices().forEach(id -> sb.append(relabel.computeIfAbsent(id, k -> relabel.size())).append(' '));
            sb.append('|');
        }
        sb.append("->");
        for (OutputTerm term : expr.outputs()) {
            term.indices().forEach(id -> sb.append(relabel.computeIfAbsent(id, k -> relabel.size())).append(' '));
            sb.append(term.fusing()).append('|');
        }
        return sb.toString();
    }
}
