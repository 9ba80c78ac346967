package fpt.com.ehraccess.domain.identity.repository;

import fpt.com.ehraccess.domain.identity.entity.Actor;
import fpt.com.ehraccess.domain.identity.entity.ActorRole;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface ActorRepository extends JpaRepository<Actor, String> {

    List<Actor> findByRoleInAndRegisteredTrueOrderByNameAsc(Collection<ActorRole> roles);
}
