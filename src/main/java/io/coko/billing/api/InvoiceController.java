package io.coko.billing.api;

import io.coko.billing.api.dto.CreateInvoiceRequest;
import io.coko.billing.api.dto.InvoiceItemRequest;
import io.coko.billing.exception.ValidationException;
import io.coko.billing.invoice.Invoice;
import io.coko.billing.invoice.InvoiceDraft;
import io.coko.billing.invoice.InvoiceItem;
import io.coko.billing.invoice.InvoiceManager;
import io.coko.billing.invoice.ItemType;
import io.coko.billing.money.CurrencyCode;
import io.coko.billing.money.Money;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/invoices")
public class InvoiceController {

	private static final Logger log = LoggerFactory.getLogger(InvoiceController.class);

	private final InvoiceManager invoiceManager;

	public InvoiceController(InvoiceManager invoiceManager) {
		this.invoiceManager = invoiceManager;
	}

	@PostMapping
	public ResponseEntity<Map<String, Object>> create(@RequestBody CreateInvoiceRequest request) {
		CurrencyCode currency = ApiRequests.currency(request.getCurrency());
		if (request.getItems() == null || request.getItems().isEmpty()) {
			throw new ValidationException("An invoice needs at least one item", "items", null);
		}
		List<InvoiceItem> items = new ArrayList<>();
		for (InvoiceItemRequest item : request.getItems()) {
			items.add(toItem(item, currency));
		}
		InvoiceDraft draft = InvoiceDraft.oneOff(request.getBillingEntity(), request.getUserRef(), currency, items);
		if (request.getDiscountMinor() != null) {
			draft = draft.withDiscount(Money.ofMinor(request.getDiscountMinor(), currency));
		}
		Invoice invoice = invoiceManager.createInvoice(draft);
		log.info("Invoice created via API: invoiceId={} number={}", invoice.getInvoiceId(), invoice.getInvoiceNumber());
		return ResponseEntity.status(HttpStatus.CREATED).body(ApiViews.invoice(invoice));
	}

	// GET /api/invoices/statistics?userRef=reader-42 ; without userRef covers every invoice
	@GetMapping("/statistics")
	public ResponseEntity<Map<String, Object>> statistics(@RequestParam(value = "userRef", required = false) String userRef) {
		String user = userRef != null && !userRef.isBlank() ? userRef.trim() : null;
		return ResponseEntity.ok(ApiViews.invoiceStatistics(invoiceManager.getInvoiceStatistics(user)));
	}

	@GetMapping("/{invoiceId}")
	public ResponseEntity<Map<String, Object>> get(@PathVariable String invoiceId) {
		Invoice invoice = invoiceManager.getInvoice(ApiRequests.uuid(invoiceId, "invoiceId"));
		return ResponseEntity.ok(ApiViews.invoice(invoice));
	}

	// GET /api/invoices?userRef=reader-42
	@GetMapping
	public ResponseEntity<List<Map<String, Object>>> list(@RequestParam("userRef") String userRef) {
		List<Map<String, Object>> result = new ArrayList<>();
		invoiceManager.listInvoices(ApiRequests.required(userRef, "userRef"))
			.forEach(invoice -> result.add(ApiViews.invoice(invoice)));
		return ResponseEntity.ok(result);
	}

	@PostMapping("/{invoiceId}/void")
	public ResponseEntity<Map<String, Object>> voidInvoice(@PathVariable String invoiceId,
			@RequestBody(required = false) Map<String, String> request) {
		String reason = request != null ? request.getOrDefault("reason", "") : "";
		Invoice invoice = invoiceManager.voidInvoice(ApiRequests.uuid(invoiceId, "invoiceId"), reason);
		return ResponseEntity.ok(ApiViews.invoice(invoice));
	}

	private static InvoiceItem toItem(InvoiceItemRequest item, CurrencyCode currency) {
		if (item.getQuantity() == null || item.getUnitPriceMinor() == null) {
			throw new ValidationException("Item quantity and unitPriceMinor are required", "items", item.getDescription());
		}
		ItemType type = item.getItemType() != null ? ItemType.fromCode(item.getItemType()) : ItemType.BOOK_PURCHASE;
		if (type == null) {
			throw new ValidationException("Unknown item type: " + item.getItemType(), "itemType", item.getItemType());
		}
		return new InvoiceItem(item.getDescription(), item.getQuantity(),
			Money.ofMinor(item.getUnitPriceMinor(), currency), type, item.getAuthorRef());
	}
}
