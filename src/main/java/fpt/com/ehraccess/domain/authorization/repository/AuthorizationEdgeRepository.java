package fpt.com.ehraccess.domain.authorization.repository;

import fpt.com.ehraccess.domain.authorization.entity.AuthorizationEdge;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface AuthorizationEdgeRepository extends JpaRepository<AuthorizationEdge, UUID> {

    Optional<AuthorizationEdge> findByPatientAddressAndProviderAddress(String patientAddress, String providerAddress);

    boolean existsByPatientAddressAndProviderAddressAndActiveTrue(String patientAddress, String providerAddress);

    @Query("SELECT e.providerAddress FROM AuthorizationEdge e WHERE e.patientAddress = :patient AND e.active = true ORDER BY e.grantedAt ASC")
    List<String> findActiveProviderAddresses(@Param("patient") String patientAddress);
}
