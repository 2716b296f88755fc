package io.mersel.services.testcase.application.interfaces;

import io.mersel.services.testcase.application.models.TestCase;

/**
 * TestCase XML belgesi ile bellek içi model arasındaki çeviri.
 * <p>
 * Okuma eski şekil varyasyonlarını tolere eder, yazma her zaman tek bir
 * kanonik şekil üretir.
 */
public interface ITestcaseCodec {

    /**
     * XML metnini TestCase modeline çevirir.
     *
     * @param xml      XML içeriği
     * @param sourceId hata mesajları ve kimlik fallback'i için kaynak (dosya adı veya yolu)
     * @return ayrıştırılmış TestCase
     * @throws DocumentParseException XML bozuksa veya kök eleman TestCase değilse
     */
    TestCase parse(String xml, String sourceId) throws DocumentParseException;

    /**
     * TestCase modelini kanonik XML'e çevirir.
     *
     * @param testCase yazılacak model
     * @return UTF-8, girintili XML
     */
    String write(TestCase testCase);
}
