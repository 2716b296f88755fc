package io.mersel.services.testcase.infrastructure;

import io.mersel.services.testcase.application.interfaces.IVariantGroupingService;
import io.mersel.services.testcase.application.models.GroupedEntry;
import io.mersel.services.testcase.application.models.ParsedTestcaseId;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * TestCase listesini temel/varyant gruplarına ayırır ve eksik numaraları/harfleri işaretler.
 * <p>
 * Çıktı dizisi:
 * <ol>
 *   <li>Önekler doğal String sırasıyla, her önek içinde numaralar artan sırada</li>
 *   <li>Aynı önekte önceki numara {@code current - 1}'den küçükse {@code base-gap}</li>
 *   <li>Varyantsız numara: temel TestCase doğrudan (grup sarmalayıcısı olmadan)</li>
 *   <li>Varyantlı numara: {@code group-start}, temel ({@code isBase}), harf sırasıyla varyantlar
 *       ve aralarında {@code variant-gap}, {@code group-end}</li>
 * </ol>
 * Varyant boşluğu yalnızca iki uç aynı harf uzunluğundaysa raporlanır; {@code Z → AA}
 * geçişi hiçbir zaman boşluk sayılmaz.
 */
@Service
public class VariantGroupingEngine implements IVariantGroupingService {

    @Override
    public <T> List<GroupedEntry<T>> group(List<T> items, Function<T, String> idExtractor) {
        var result = new ArrayList<GroupedEntry<T>>();
        if (items == null || items.isEmpty()) {
            return result;
        }

        Map<String, TreeMap<Integer, NumberGroup<T>>> byPrefix = partition(items, idExtractor);

        for (var prefixEntry : byPrefix.entrySet()) {
            String prefix = prefixEntry.getKey();
            int lastNumber = 0;

            for (var numberEntry : prefixEntry.getValue().entrySet()) {
                int number = numberEntry.getKey();
                NumberGroup<T> group = numberEntry.getValue();

                // 0 numaralı (veya ilk) temelden sonra boşluk bildirilmez
                if (lastNumber > 0 && number - lastNumber > 1) {
                    result.add(GroupedEntry.baseGap(prefix, lastNumber, number,
                            formatId(prefix, lastNumber), formatId(prefix, number)));
                }
                lastNumber = number;

                emitGroup(result, group, prefix + padNumber(number));
            }
        }
        return result;
    }

    private <T> Map<String, TreeMap<Integer, NumberGroup<T>>> partition(List<T> items,
                                                                        Function<T, String> idExtractor) {
        Map<String, TreeMap<Integer, NumberGroup<T>>> byPrefix = new TreeMap<>();
        for (T item : items) {
            ParsedTestcaseId parsed = TestcaseIdParser.parse(idExtractor.apply(item));
            NumberGroup<T> group = byPrefix
                    .computeIfAbsent(parsed.prefix(), k -> new TreeMap<>())
                    .computeIfAbsent(parsed.number(), k -> new NumberGroup<>());
            if (parsed.hasVariant()) {
                group.variants.add(new VariantMember<>(item, parsed.variant(),
                        TestcaseIdParser.variantToNumber(parsed.variant())));
            } else {
                // aynı numarada sonraki temel öncekinin yerini alır
                group.base = item;
            }
        }
        return byPrefix;
    }

    private <T> void emitGroup(List<GroupedEntry<T>> result, NumberGroup<T> group, String groupId) {
        if (group.variants.isEmpty()) {
            if (group.base != null) {
                result.add(GroupedEntry.ofTestcase(group.base));
            }
            return;
        }

        int memberCount = group.variants.size() + (group.base != null ? 1 : 0);
        result.add(GroupedEntry.groupStart(groupId, memberCount));
        if (group.base != null) {
            result.add(GroupedEntry.baseMember(group.base));
        }

        group.variants.sort(Comparator.comparingInt(VariantMember::order));
        boolean hasPrevious = false;
        int lastOrder = 0;
        for (VariantMember<T> variant : group.variants) {
            if (hasPrevious
                    && variant.order() - lastOrder > 1
                    && TestcaseIdParser.letterLength(lastOrder) == TestcaseIdParser.letterLength(variant.order())) {
                result.add(GroupedEntry.variantGap(groupId,
                        TestcaseIdParser.numberToVariant(lastOrder),
                        TestcaseIdParser.numberToVariant(variant.order()),
                        variant.order() - lastOrder - 1));
            }
            hasPrevious = true;
            lastOrder = variant.order();
            result.add(GroupedEntry.variantMember(variant.item(), variant.letters()));
        }

        result.add(GroupedEntry.groupEnd(groupId));
    }

    private static String formatId(String prefix, int number) {
        return prefix + padNumber(number);
    }

    private static String padNumber(int number) {
        return String.format("%02d", number);
    }

    private static final class NumberGroup<T> {
        private T base;
        private final List<VariantMember<T>> variants = new ArrayList<>();
    }

    private record VariantMember<T>(T item, String letters, int order) {
    }
}
