package got.mail.app.controller;

import got.mail.app.dto.request.SendEmailRequest;
import got.mail.app.dto.response.EmailResponse;
import got.mail.app.entity.User;
import got.mail.app.service.EmailSearchCriteria;
import got.mail.app.service.EmailService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/emails")
public class EmailController {
    private final EmailService emailService;

    public EmailController(EmailService emailService) {
        this.emailService = emailService;
    }

    @PostMapping("/send")
    public ResponseEntity<EmailResponse> send(@AuthenticationPrincipal User user,
                                              @Valid @RequestBody SendEmailRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(emailService.send(user, request));
    }

    /**
     * Sent and received mail, excluding trash. A date range needs both bounds; unknown
     * status values are ignored.
     */
    @GetMapping("/search")
    public ResponseEntity<List<EmailResponse>> search(
            @AuthenticationPrincipal User user,
            @RequestParam(required = false) String q,
            @RequestParam(name = "start_date", required = false) String startDate,
            @RequestParam(name = "end_date", required = false) String endDate,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String label,
            @RequestParam(name = "has_attachments", required = false) String hasAttachments) {
        EmailSearchCriteria criteria = EmailSearchCriteria.fromQuery(q, startDate, endDate, status, label, hasAttachments);
        return ResponseEntity.ok(emailService.search(user, criteria));
    }
}
