package io.mersel.services.testcase.application.interfaces;

import io.mersel.services.testcase.application.models.ProfileConfiguration;

/**
 * ProfileConfiguration XML belgesi ile bellek içi model arasındaki çeviri.
 */
public interface IProfileConfigurationCodec {

    /**
     * @param xml      XML içeriği
     * @param sourceId hata mesajları için kaynak
     * @return ayrıştırılmış yapılandırma (eski şekiller normalize edilmiş)
     * @throws DocumentParseException XML bozuksa veya kök eleman ProfileConfiguration değilse
     */
    ProfileConfiguration parse(String xml, String sourceId) throws DocumentParseException;

    String write(ProfileConfiguration configuration);
}
