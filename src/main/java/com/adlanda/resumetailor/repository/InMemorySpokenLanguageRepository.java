package com.adlanda.resumetailor.repository;

import com.adlanda.resumetailor.model.SpokenLanguage;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;

@Repository
public class InMemorySpokenLanguageRepository extends InMemoryRepository<SpokenLanguage>
        implements SpokenLanguageRepository {

    public InMemorySpokenLanguageRepository() {
        super(SpokenLanguage::getId);
    }

    @Override
    public List<SpokenLanguage> findByUserId(String userId) {
        return findAll(l -> l.getUserId().equals(userId), Comparator.comparingInt(SpokenLanguage::getDisplayOrder));
    }
}
