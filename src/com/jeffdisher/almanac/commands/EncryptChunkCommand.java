package com.jeffdisher.almanac.commands;

import java.io.File;

import com.jeffdisher.almanac.codec.EncryptionCodec;
import com.jeffdisher.almanac.commands.results.ChunkTransform;
import com.jeffdisher.almanac.types.AlmanacException;


/**
 * Encrypts one chunk file into the nonce|tag|ciphertext frame.
 */
public record EncryptChunkCommand(File input, File output, String header) implements ICommand<ChunkTransform>
{
	@Override
	public ChunkTransform runInContext(Context context) throws AlmanacException
	{
		EncryptionCodec codec = new EncryptionCodec(context.keys, this.header);
		byte[] plaintext = ChunkFiles.read(this.input);
		byte[] frame = codec.encode(plaintext);
		ChunkFiles.write(this.output, frame);
		context.logger.logVerbose("Encrypted " + this.input + " with header \"" + this.header + "\"");
		return new ChunkTransform("Encrypted", this.output, plaintext.length, frame.length);
	}
}
