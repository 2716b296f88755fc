package io.mersel.services.testcase.application.interfaces;

import io.mersel.services.testcase.application.models.GroupedEntry;

import java.util.List;
import java.util.function.Function;

/**
 * TestCase listesini temel/varyant gruplarına ayırıp eksik numara ve harfleri
 * tespit eden servis.
 */
public interface IVariantGroupingService {

    /**
     * @param items       TestCase özetleri
     * @param idExtractor özetten kimliği çıkaran fonksiyon
     * @param <T>         özet tipi
     * @return oluşturucunun tükettiği sıralı girdi dizisi
     */
    <T> List<GroupedEntry<T>> group(List<T> items, Function<T, String> idExtractor);
}
