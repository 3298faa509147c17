package io.wzbankapi.sdk;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class WzBankApi {
  public static final String QUERY_ACCOUNT_BALANCE = "V1/P01502/S01/queryeaccountbalance";
  public static final String SINGLE_TRANSFER = "V1/P01506/S01/singletrans";
  public static final String QUERY_SINGLE_TRANSFER = "V1/P01507/S01/selsingletrans";
  public static final String BATCH_TRANSFER = "V1/P01508/S01/batchtrans";
  public static final String QUERY_BATCH_TRANSFER = "V1/P01509/S01/selbatchtrans";
  public static final String QUERY_HOUR_DETAILS = "V1/P01512/S01/queryhourdetails";
  public static final String DETAILS_RECEIPT = "V1/P01513/S01/detailsreceipt";
  public static final String CHECK_ACCOUNT = "V1/P01518/S01/checkAcct";
  public static final String CHECK_RESULT_UPDATE = "V1/P01519/S01/checkResultUpdate";
  public static final String QUERY_SUB_ACCOUNT_BALANCE = "V1/P01520/S01/queryeSubacctBalance";
  public static final String QUERY_HOUR_DETAILS_2 = "V1/P01522/S01/queryhourdetails2";
  public static final String QUERY_RECEIPT_DETAILS = "V1/P01523/S01/queryreceiptdetails";
  public static final String QUERY_BANK_INFOS = "V1/P01524/S01/querybankinfos";
  public static final String QUERY_CERT_EXPIRY = "V1/P01525/S01/queryCertExpiry";

  private static final List<String> SINGLE_TRANSFER_REQUIRED = List.of(
      "payAcctNo", "transAmt", "payAcctName", "rcvAcctNo", "rcvAcctName", "inbankno", "orderNo", "reserve2");

  private final WzBankClient client;

  public WzBankApi(WzBankClient client) {
    this.client = client;
  }

  public WzBank.BankResponse queryAccountBalance(String payAcctNo) {
    return queryAccountBalance(payAcctNo, null);
  }

  public WzBank.BankResponse queryAccountBalance(String payAcctNo, Map<String, ?> common) {
    requireText("payAcctNo", payAcctNo);
    Map<String, Object> body = body(common);
    body.put("payAcctNo", payAcctNo);
    return client.post(QUERY_ACCOUNT_BALANCE, body);
  }

  /** {@code curCode} defaults to "1" and {@code curType} to "0" when absent or empty. */
  public WzBank.BankResponse singleTransfer(Map<String, ?> fields) {
    Map<String, Object> body = body(fields);
    for (String name : SINGLE_TRANSFER_REQUIRED) {
      requireText(name, body.get(name));
    }
    if (isEmpty(body.get("curCode"))) {
      body.put("curCode", "1");
    }
    if (isEmpty(body.get("curType"))) {
      body.put("curType", "0");
    }
    return client.post(SINGLE_TRANSFER, body);
  }

  public WzBank.BankResponse querySingleTransferResult(Map<String, ?> fields) {
    return client.post(QUERY_SINGLE_TRANSFER, body(fields));
  }

  public WzBank.BankResponse batchTransfer(Map<String, ?> fields) {
    return client.post(BATCH_TRANSFER, body(fields));
  }

  public WzBank.BankResponse queryBatchTransferResult(String payAcctNo, String batchNo, Map<String, ?> common) {
    requireText("payAcctNo", payAcctNo);
    requireText("batchNo", batchNo);
    Map<String, Object> body = body(common);
    body.put("payAcctNo", payAcctNo);
    body.put("batchNo", batchNo);
    return client.post(QUERY_BATCH_TRANSFER, body);
  }

  public WzBank.BankResponse queryHourDetails(String payAcctNo, String startDate, String endDate, Map<String, ?> common) {
    return client.post(QUERY_HOUR_DETAILS, accountRange(payAcctNo, startDate, endDate, common));
  }

  public WzBank.BankResponse downloadDetailsReceipt(
      String acctNo,
      String transDate,
      String transSeqno,
      String transOperNo,
      String transBrno,
      Map<String, ?> common
  ) {
    requireText("acctNo", acctNo);
    requireText("transDate", transDate);
    requireText("transSeqno", transSeqno);
    Map<String, Object> body = body(common);
    body.put("acctNo", acctNo);
    body.put("transDate", transDate);
    body.put("transSeqno", transSeqno);
    if (transOperNo != null) {
      body.put("transOperNo", transOperNo);
    }
    if (transBrno != null) {
      body.put("transBrno", transBrno);
    }
    return client.post(DETAILS_RECEIPT, body);
  }

  public WzBank.BankResponse checkAccount(String payAcctNo, String startDate, String endDate, Map<String, ?> common) {
    return client.post(CHECK_ACCOUNT, accountRange(payAcctNo, startDate, endDate, common));
  }

  public WzBank.BankResponse updateCheckResult(Map<String, ?> fields) {
    return client.post(CHECK_RESULT_UPDATE, body(fields));
  }

  public WzBank.BankResponse querySubAccountBalance(String payAcctNo, Map<String, ?> common) {
    requireText("payAcctNo", payAcctNo);
    Map<String, Object> body = body(common);
    body.put("payAcctNo", payAcctNo);
    return client.post(QUERY_SUB_ACCOUNT_BALANCE, body);
  }

  public WzBank.BankResponse queryHourDetails2(String payAcctNo, String startDate, String endDate, Map<String, ?> common) {
    return client.post(QUERY_HOUR_DETAILS_2, accountRange(payAcctNo, startDate, endDate, common));
  }

  public WzBank.BankResponse queryReceiptDetails(Map<String, ?> fields) {
    return client.post(QUERY_RECEIPT_DETAILS, body(fields));
  }

  /** {@code type} "0" looks up by {@code bankName}, "1" by {@code bankNo}. */
  public WzBank.BankResponse queryBankInfos(String type, String bankName, String bankNo, Map<String, ?> common) {
    requireText("type", type);
    Map<String, Object> body = body(common);
    body.put("type", type);
    if ("0".equals(type)) {
      if (WzBank.isBlank(bankName)) {
        throw new IllegalArgumentException("type=0 requires bankName");
      }
      body.put("bankName", bankName);
    } else if ("1".equals(type)) {
      if (WzBank.isBlank(bankNo)) {
        throw new IllegalArgumentException("type=1 requires bankNo");
      }
      body.put("bankNo", bankNo);
    }
    return client.post(QUERY_BANK_INFOS, body);
  }

  public WzBank.BankResponse queryCertExpiry(String payAcctNo, Map<String, ?> common) {
    requireText("payAcctNo", payAcctNo);
    Map<String, Object> body = body(common);
    body.put("payAcctNo", payAcctNo);
    return client.post(QUERY_CERT_EXPIRY, body);
  }

  private Map<String, Object> accountRange(String payAcctNo, String startDate, String endDate, Map<String, ?> common) {
    requireText("payAcctNo", payAcctNo);
    requireText("startDate", startDate);
    requireText("endDate", endDate);
    Map<String, Object> body = body(common);
    body.put("payAcctNo", payAcctNo);
    body.put("startDate", startDate);
    body.put("endDate", endDate);
    return body;
  }

  private Map<String, Object> body(Map<String, ?> fields) {
    Map<String, Object> body = new LinkedHashMap<>(client.metadata().next());
    if (fields != null) {
      body.putAll(fields);
    }
    return body;
  }

  private static void requireText(String name, Object value) {
    if (isEmpty(value)) {
      throw new IllegalArgumentException(name + " is required");
    }
  }

  private static boolean isEmpty(Object value) {
    return value == null || (value instanceof String && ((String) value).trim().isEmpty());
  }
}
