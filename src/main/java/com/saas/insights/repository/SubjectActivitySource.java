package com.saas.insights.repository;

import com.saas.insights.model.SubjectActivity;

import java.util.List;
import java.util.Optional;

public interface SubjectActivitySource {

    /**
     * @return empty when the subject is unknown
     * @throws DataUnavailableException when the store could not be read
     */
    Optional<SubjectActivity> findBySubjectId(String subjectId);

    /**
     * Up to {@code limit} known subject ids, in no particular order.
     */
    List<String> listSubjectIds(int limit);
}
