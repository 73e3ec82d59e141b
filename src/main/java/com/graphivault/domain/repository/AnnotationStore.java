package com.graphivault.domain.repository;

import com.graphivault.domain.model.Annotation;

import java.util.List;

public interface AnnotationStore {

    /**
     * @return newly assigned annotation id
     * @throws com.graphivault.domain.exception.AssetReferenceException if no asset row has this id
     */
    long addAnnotation(long assetId, String note);

    /**
     * Annotations of one asset, oldest first.
     */
    List<Annotation> listAnnotations(long assetId);
}
