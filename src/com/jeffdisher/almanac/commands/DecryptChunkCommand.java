package com.jeffdisher.almanac.commands;

import java.io.File;

import com.jeffdisher.almanac.codec.EncryptionCodec;
import com.jeffdisher.almanac.commands.results.ChunkTransform;
import com.jeffdisher.almanac.types.AlmanacException;


/**
 * Decrypts one chunk frame.  Nothing is written to the output file unless the frame authenticates.
 */
public record DecryptChunkCommand(File input, File output, String header) implements ICommand<ChunkTransform>
{
	@Override
	public ChunkTransform runInContext(Context context) throws AlmanacException
	{
		EncryptionCodec codec = new EncryptionCodec(context.keys, this.header);
		byte[] frame = ChunkFiles.read(this.input);
		byte[] plaintext = codec.decode(frame);
		ChunkFiles.write(this.output, plaintext);
		return new ChunkTransform("Decrypted", this.output, frame.length, plaintext.length);
	}
}
