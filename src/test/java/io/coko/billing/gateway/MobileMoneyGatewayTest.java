package io.coko.billing.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.coko.billing.config.BillingEngineProperties;
import io.coko.billing.exception.UnauthenticatedWebhookException;
import io.coko.billing.exception.ValidationException;
import io.coko.billing.ledger.PaymentTransaction;
import io.coko.billing.ledger.TransactionStatus;
import io.coko.billing.metrics.BillingMetrics;
import io.coko.billing.money.CurrencyCode;
import io.coko.billing.money.Money;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.Signature;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Webhook authentication and payload mapping of the Orange Money and MTN MoMo gateways.
 */
@ExtendWith(MockitoExtension.class)
class MobileMoneyGatewayTest {

	private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-03-01T12:00:00Z"), ZoneOffset.UTC);

	@Mock
	private BillingMetrics metrics;

	private OrangeMoneyGateway orange;
	private MtnMomoGateway mtn;
	private KeyPair callbackKeys;

	@BeforeEach
	void setUp() throws Exception {
		KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
		generator.initialize(2048);
		callbackKeys = generator.generateKeyPair();
		String pem = "-----BEGIN PUBLIC KEY-----\n"
			+ Base64.getMimeEncoder(64, "\n".getBytes(StandardCharsets.US_ASCII))
				.encodeToString(callbackKeys.getPublic().getEncoded())
			+ "\n-----END PUBLIC KEY-----\n";

		BillingEngineProperties props = new BillingEngineProperties();
		props.getProviders().getOrangeMoney().setNotificationToken("notif-secret");
		props.getProviders().getMtnMomo().setCallbackPublicKey(pem);
		orange = new OrangeMoneyGateway(props, new ObjectMapper(), metrics, CLOCK);
		mtn = new MtnMomoGateway(props, new ObjectMapper(), metrics, CLOCK);
	}

	private static String sign(PrivateKey key, byte[] body) throws Exception {
		Signature signer = Signature.getInstance("SHA256withRSA");
		signer.initSign(key);
		signer.update(body);
		return Base64.getEncoder().encodeToString(signer.sign());
	}

	// ============ Orange Money ============

	@Test
	void orange_matchingToken_passes() {
		assertThatCode(() -> orange.verifyWebhookSignature("{}".getBytes(StandardCharsets.UTF_8), "notif-secret"))
			.doesNotThrowAnyException();
	}

	@Test
	void orange_wrongOrMissingToken_isRejected() {
		byte[] body = "{}".getBytes(StandardCharsets.UTF_8);

		assertThatThrownBy(() -> orange.verifyWebhookSignature(body, "notif-secreT"))
			.isInstanceOf(UnauthenticatedWebhookException.class);
		assertThatThrownBy(() -> orange.verifyWebhookSignature(body, " "))
			.isInstanceOf(UnauthenticatedWebhookException.class);
	}

	@Test
	void orange_success_mapsMajorAmountToSettledCharge() {
		String json = "{\"status\":\"SUCCESS\",\"txnid\":\"MP250301.1200.A1\",\"amount\":\"5000\",\"currency\":\"XOF\"}";

		PaymentTransaction tx = orange.normalizeWebhookPayload(json.getBytes(StandardCharsets.UTF_8)).orElseThrow();

		assertThat(tx.getStatus()).isEqualTo(TransactionStatus.SETTLED);
		assertThat(tx.getAmount()).isEqualTo(Money.ofMinor(5000, CurrencyCode.XOF));
		assertThat(tx.getProviderTransactionId()).isEqualTo("MP250301.1200.A1");
	}

	@Test
	void orange_failedWithoutTxnId_fallsBackToOrderId() {
		String json = "{\"status\":\"EXPIRED\",\"order_id\":\"order-9\",\"amount\":\"100\",\"currency\":\"XOF\"}";

		PaymentTransaction tx = orange.normalizeWebhookPayload(json.getBytes(StandardCharsets.UTF_8)).orElseThrow();

		assertThat(tx.getStatus()).isEqualTo(TransactionStatus.FAILED);
		assertThat(tx.getProviderTransactionId()).isEqualTo("order-9");
		assertThat(tx.getFailureCode()).isEqualTo("expired");
	}

	@Test
	void orange_pending_carriesNoMoneyMovement() {
		String json = "{\"status\":\"PENDING\",\"txnid\":\"x\"}";

		assertThat(orange.normalizeWebhookPayload(json.getBytes(StandardCharsets.UTF_8))).isEmpty();
	}

	@Test
	void orange_fractionalXof_isRejected() {
		String json = "{\"status\":\"SUCCESS\",\"txnid\":\"t1\",\"amount\":\"10.50\",\"currency\":\"XOF\"}";

		assertThatThrownBy(() -> orange.normalizeWebhookPayload(json.getBytes(StandardCharsets.UTF_8)))
			.isInstanceOf(ValidationException.class);
	}

	// ============ MTN MoMo ============

	@Test
	void mtn_validRsaSignature_passes() throws Exception {
		byte[] body = "{\"status\":\"SUCCESSFUL\"}".getBytes(StandardCharsets.UTF_8);
		String signature = sign(callbackKeys.getPrivate(), body);

		assertThatCode(() -> mtn.verifyWebhookSignature(body, signature)).doesNotThrowAnyException();
	}

	@Test
	void mtn_signatureFromOtherKey_isRejected() throws Exception {
		KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
		generator.initialize(2048);
		byte[] body = "{\"status\":\"SUCCESSFUL\"}".getBytes(StandardCharsets.UTF_8);
		String forged = sign(generator.generateKeyPair().getPrivate(), body);

		assertThatThrownBy(() -> mtn.verifyWebhookSignature(body, forged))
			.isInstanceOf(UnauthenticatedWebhookException.class);
	}

	@Test
	void mtn_nonBase64Signature_isRejected() {
		assertThatThrownBy(() -> mtn.verifyWebhookSignature("{}".getBytes(StandardCharsets.UTF_8), "not*base64"))
			.isInstanceOf(UnauthenticatedWebhookException.class);
	}

	@Test
	void mtn_failedCallback_usesReasonCode() {
		String json = "{\"status\":\"FAILED\",\"referenceId\":\"ref-1\",\"amount\":\"250\",\"currency\":\"XAF\","
			+ "\"reason\":{\"code\":\"PAYER_NOT_FOUND\"}}";

		PaymentTransaction tx = mtn.normalizeWebhookPayload(json.getBytes(StandardCharsets.UTF_8)).orElseThrow();

		assertThat(tx.getStatus()).isEqualTo(TransactionStatus.FAILED);
		assertThat(tx.getProviderTransactionId()).isEqualTo("ref-1");
		assertThat(tx.getFailureCode()).isEqualTo("payer_not_found");
	}
}
