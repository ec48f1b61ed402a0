package io.livclinic.clinic.patient;

import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface PatientRepository extends JpaRepository<Patient, UUID> {

  Optional<Patient> findByIdAndDeletedFalse(UUID id);
}
