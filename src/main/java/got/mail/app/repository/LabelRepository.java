package got.mail.app.repository;

import got.mail.app.entity.Label;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface LabelRepository extends JpaRepository<Label, String> {
    List<Label> findByUserIdOrderByNameAsc(String userId);
    List<Label> findByUserIdAndNameIn(String userId, Collection<String> names);
}
