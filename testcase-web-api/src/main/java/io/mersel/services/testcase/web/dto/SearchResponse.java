package io.mersel.services.testcase.web.dto;

import io.mersel.services.testcase.application.models.SearchResult;

import java.util.List;

/**
 * Arama yanıtı.
 *
 * @param results Eşleşen TestCase'ler (boş sorguda boş liste)
 */
public record SearchResponse(List<SearchResult> results) {
}
