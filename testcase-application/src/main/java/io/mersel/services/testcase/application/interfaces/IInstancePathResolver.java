package io.mersel.services.testcase.application.interfaces;

import io.mersel.services.testcase.application.models.InstancePaths;

/**
 * Instance adını doğrulanmış dizin yollarına çevirir.
 */
public interface IInstancePathResolver {

    /**
     * @param instanceName instance adı ({@code ^[a-zA-Z0-9_-]+$})
     * @return instance ve testcases dizinleri
     * @throws IllegalArgumentException ad geçersizse
     * @throws DocumentNotFoundException instance dizini yoksa
     */
    InstancePaths resolve(String instanceName) throws DocumentNotFoundException;
}
