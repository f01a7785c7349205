package com.adlanda.resumetailor.repository;

import com.adlanda.resumetailor.model.UserProfile;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryUserRepository extends InMemoryRepository<UserProfile> implements UserRepository {

    public InMemoryUserRepository() {
        super(UserProfile::id);
    }

    @Override
    public boolean existsById(String id) {
        return findById(id).isPresent();
    }
}
