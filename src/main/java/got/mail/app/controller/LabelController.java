package got.mail.app.controller;

import got.mail.app.dto.response.LabelResponse;
import got.mail.app.entity.User;
import got.mail.app.repository.LabelRepository;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

@RestController
public class LabelController {
    private final LabelRepository labelRepository;

    public LabelController(LabelRepository labelRepository) {
        this.labelRepository = labelRepository;
    }

    @GetMapping("/labels")
    @Transactional(readOnly = true)
    public ResponseEntity<List<LabelResponse>> listLabels(@AuthenticationPrincipal User user) {
        List<LabelResponse> labels = labelRepository.findByUserIdOrderByNameAsc(user.getId()).stream()
                .map(LabelResponse::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(labels);
    }
}
