package com.fragrance.enrichment.model;

import com.fragrance.enrichment.matching.Identifiable;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Whatever one source knew about one query. Only {@link #source} and
 * {@link #query} are guaranteed; every other slot may be {@code null}.
 */
@Value
@Builder(toBuilder = true)
public class PartialRecord implements Identifiable {

    @NonNull
    SourceId source;

    @NonNull
    Query query;

    /** Name as reported by the source (title, record name). */
    String name;

    String casNumber;

    /** Source-assigned numeric id (PubChem CID). */
    Long compoundId;

    String molecularFormula;

    String molecularWeight;

    String iupacName;

    String odorDescription;

    String odorFamily;

    String odorStrength;

    String appearance;

    String flashPoint;

    String solubility;

    String logP;

    String shelfLife;

    String tenacity;

    String einecs;

    String fema;

    @Singular
    List<String> synonyms;

    @Override
    public String identityName() {
        return name != null ? name : query.getDisplayName();
    }

    @Override
    public Optional<String> registryNumber() {
        return Optional.ofNullable(casNumber);
    }

    /** True when the source returned nothing beyond what we asked for. */
    public boolean isEmpty() {
        return IngredientField.stream().allMatch(f -> f.valueOf(this) == null)
                && synonyms.isEmpty();
    }
}
