package com.museum.curation.pipeline.stage;

import com.museum.curation.adapter.SourceAdapter;
import com.museum.curation.adapter.SourceException;
import com.museum.curation.adapter.SourceRequest;
import com.museum.curation.adapter.SourceResponse;
import com.museum.curation.core.model.MuseumFields;
import com.museum.curation.core.model.MuseumRecord;
import com.museum.curation.pipeline.CostEstimate;
import com.museum.curation.pipeline.PipelineStage;
import com.museum.curation.pipeline.StageContext;
import com.museum.curation.pipeline.StageException;
import com.museum.curation.pipeline.StageName;
import com.museum.curation.pipeline.StageOutput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiPredicate;
import java.util.function.Function;

/**
 * Stage backed by a {@link SourceAdapter}: builds a request from the record, calls
 * the adapter and hands its candidates to the applier. Used for identity resolution,
 * encyclopedia lookup and the model-judged scoring stage.
 *
 * <pre>
 * AdapterStage llm = AdapterStage.builder()
 *         .name(StageName.LLM_JUDGED_SCORING)
 *         .adapter(new CachingSourceAdapter(judge, cache))
 *         .outputFields(MuseumFields.SCORING_FIELDS)
 *         .targeted(true)
 *         .build();
 * </pre>
 */
public class AdapterStage implements PipelineStage {
    private static final Logger log = LoggerFactory.getLogger(AdapterStage.class);

    private static final List<String> DEFAULT_REQUEST_FIELDS = List.of(
            MuseumFields.MUSEUM_NAME, MuseumFields.CITY, MuseumFields.STATE_PROVINCE, MuseumFields.WEBSITE);

    private final StageName name;
    private final SourceAdapter adapter;
    private final Function<MuseumRecord, SourceRequest> requestFactory;
    private final BiPredicate<MuseumRecord, StageContext> appliesTo;
    private final Set<String> outputFields;
    private final boolean targeted;

    private AdapterStage(Builder builder) {
        this.name = builder.name;
        this.adapter = builder.adapter;
        this.requestFactory = builder.requestFactory;
        this.appliesTo = builder.appliesTo;
        this.outputFields = Set.copyOf(builder.outputFields);
        this.targeted = builder.targeted;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Request carrying the record's identifying fields; absent fields are left out.
     */
    public static SourceRequest defaultRequest(MuseumRecord record) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        for (String field : DEFAULT_REQUEST_FIELDS) {
            Object value = record.get(field);
            if (value != null) {
                parameters.put(field, value);
            }
        }
        return SourceRequest.of(record.getRecordId(), parameters);
    }

    @Override
    public StageName name() {
        return name;
    }

    @Override
    public boolean appliesTo(MuseumRecord record, StageContext context) {
        return appliesTo.test(record, context);
    }

    @Override
    public CostEstimate estimateCost(MuseumRecord record) {
        return adapter.estimateCost(requestFactory.apply(record));
    }

    @Override
    public boolean isTargeted() {
        return targeted;
    }

    @Override
    public StageOutput process(MuseumRecord record, StageContext context) {
        SourceRequest request = requestFactory.apply(record);
        SourceResponse response;
        try {
            response = adapter.fetch(request);
        } catch (SourceException e) {
            throw new StageException(adapter.name() + " failed for " + record.getRecordId() + ": " + e.getMessage(), e);
        }
        if (response == null) {
            throw new StageException(adapter.name() + " returned no response for " + record.getRecordId());
        }
        log.debug("adapter.fetched adapter={} candidates={} recommendations={}",
                adapter.name(), response.candidates().size(), response.recommendations().size());
        return new StageOutput(response.candidates(), Map.of(), response.recommendations());
    }

    /**
     * True when every output field holds a value.
     */
    @Override
    public boolean hasOutput(MuseumRecord record) {
        return outputFields.stream().allMatch(record::has);
    }

    public SourceAdapter getAdapter() {
        return adapter;
    }

    public Set<String> getOutputFields() {
        return outputFields;
    }

    @Override
    public String toString() {
        return "AdapterStage{" +
                "name=" + name +
                ", adapter=" + adapter.name() +
                ", targeted=" + targeted +
                '}';
    }

    public static class Builder {
        private StageName name;
        private SourceAdapter adapter;
        private Function<MuseumRecord, SourceRequest> requestFactory = AdapterStage::defaultRequest;
        private BiPredicate<MuseumRecord, StageContext> appliesTo = (record, context) -> true;
        private final Set<String> outputFields = new LinkedHashSet<>();
        private boolean targeted = false;

        public Builder name(StageName name) {
            this.name = name;
            return this;
        }

        public Builder adapter(SourceAdapter adapter) {
            this.adapter = adapter;
            return this;
        }

        public Builder requestFactory(Function<MuseumRecord, SourceRequest> requestFactory) {
            this.requestFactory = Objects.requireNonNull(requestFactory, "requestFactory is required");
            return this;
        }

        public Builder appliesTo(BiPredicate<MuseumRecord, StageContext> appliesTo) {
            this.appliesTo = Objects.requireNonNull(appliesTo, "appliesTo is required");
            return this;
        }

        /**
         * Fields whose presence marks a record as done by this stage.
         */
        public Builder outputFields(Set<String> fields) {
            this.outputFields.addAll(fields);
            return this;
        }

        public Builder outputField(String field) {
            this.outputFields.add(field);
            return this;
        }

        /**
         * Restricts the stage to the run's top-N targets.
         */
        public Builder targeted(boolean targeted) {
            this.targeted = targeted;
            return this;
        }

        public AdapterStage build() {
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(adapter, "adapter is required");
            if (!name.isPerPartition()) {
                throw new IllegalArgumentException(name + " cannot be backed by an adapter");
            }
            if (outputFields.isEmpty()) {
                throw new IllegalArgumentException("At least one output field is required");
            }
            return new AdapterStage(this);
        }
    }
}
